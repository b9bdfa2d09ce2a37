/*
 * どこで: Commerce API
 * 何を: 注文作成リクエストの入力を保持する
 * なぜ: 明細の中身は OrderValidator で全件検証するため、ここでは形だけを縛る
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateOrderRequest(
    Long customerId,
    @Size(max = 500, message = "shipping_address must be at most 500 characters")
        String shippingAddress,
    List<OrderItemRequest> items) {

  public CreateOrderRequest {
    // null 要素も検証で違反として報告するため List.copyOf は使わない。
    if (items != null) {
      items = Collections.unmodifiableList(new ArrayList<>(items));
    }
  }
}

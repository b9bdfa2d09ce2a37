/*
 * どこで: Commerce API
 * 何を: 注文明細 1 行の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderItemRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderItemResponse(
    long orderItemId, long productId, int quantity, BigDecimal unitPrice, BigDecimal lineTotal) {

  public static OrderItemResponse from(OrderItemRecord item) {
    return new OrderItemResponse(
        item.orderItemId(), item.productId(), item.quantity(), item.unitPrice(), item.lineTotal());
  }
}

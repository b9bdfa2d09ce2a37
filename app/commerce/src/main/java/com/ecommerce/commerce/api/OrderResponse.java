/*
 * どこで: Commerce API
 * 何を: 注文ヘッダと明細のスナップショットを表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderResponse(
    long orderId,
    long customerId,
    Instant orderDate,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    OrderStatus status,
    String shippingAddress,
    Instant createdAt,
    Instant modifiedAt,
    List<OrderItemResponse> items) {

  public OrderResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static OrderResponse from(OrderRecord order, List<OrderItemRecord> items) {
    return new OrderResponse(
        order.orderId(),
        order.customerId(),
        order.orderDate(),
        order.subtotal(),
        order.taxAmount(),
        order.totalAmount(),
        order.status(),
        order.shippingAddress(),
        order.createdAt(),
        order.modifiedAt(),
        items.stream().map(OrderItemResponse::from).toList());
  }
}

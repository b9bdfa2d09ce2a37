/*
 * どこで: Commerce API
 * 何を: 注文作成結果のレスポンスを表す
 * なぜ: 同じ Idempotency-Key の再送へ同一 JSON を返せるよう保存対象にもなる
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderCreatedResponse(
    long orderId,
    long customerId,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    OrderStatus status,
    Instant orderDate) {

  public static OrderCreatedResponse from(OrderRecord order) {
    return new OrderCreatedResponse(
        order.orderId(),
        order.customerId(),
        order.subtotal(),
        order.taxAmount(),
        order.totalAmount(),
        order.status(),
        order.orderDate());
  }
}

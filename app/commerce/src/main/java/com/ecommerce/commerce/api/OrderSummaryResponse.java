/*
 * どこで: Commerce API
 * 何を: 注文一覧 1 行 (明細なし) の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderSummaryResponse(
    long orderId, long customerId, Instant orderDate, BigDecimal totalAmount, OrderStatus status) {

  public static OrderSummaryResponse from(OrderRecord order) {
    return new OrderSummaryResponse(
        order.orderId(), order.customerId(), order.orderDate(), order.totalAmount(), order.status());
  }
}

/*
 * どこで: Commerce API
 * 何を: 顧客の注文履歴 1 件の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** items は明細を要求されたときだけ出力する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderHistoryEntryResponse(
    long orderId,
    Instant orderDate,
    OrderStatus status,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    List<OrderItemResponse> items) {

  public static OrderHistoryEntryResponse from(OrderRecord order, List<OrderItemRecord> items) {
    return new OrderHistoryEntryResponse(
        order.orderId(),
        order.orderDate(),
        order.status(),
        order.subtotal(),
        order.taxAmount(),
        order.totalAmount(),
        items == null ? null : items.stream().map(OrderItemResponse::from).toList());
  }
}

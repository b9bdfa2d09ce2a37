/*
 * どこで: Commerce API
 * 何を: 保存済み明細から再計算した合計の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderTotals;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderTotalsResponse(
    long orderId, int itemCount, BigDecimal subtotal, BigDecimal taxAmount, BigDecimal totalAmount) {

  public static OrderTotalsResponse of(long orderId, int itemCount, OrderTotals totals) {
    return new OrderTotalsResponse(
        orderId, itemCount, totals.subtotal(), totals.taxAmount(), totals.totalAmount());
  }
}

/*
 * どこで: Commerce API
 * 何を: 顧客の注文履歴 (期間/件数/購入額/注文一覧) の応答を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** total_spent はキャンセル/返金済みを除いた合計。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerOrderHistoryResponse(
    long customerId,
    String customerName,
    Instant from,
    Instant to,
    int orderCount,
    BigDecimal totalSpent,
    List<OrderHistoryEntryResponse> orders) {

  public CustomerOrderHistoryResponse {
    orders = orders == null ? List.of() : List.copyOf(orders);
  }
}

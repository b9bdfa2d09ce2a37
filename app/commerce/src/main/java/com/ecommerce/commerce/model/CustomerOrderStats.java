/*
 * どこで: Commerce ドメインモデル
 * 何を: 顧客 1 人の期間内の注文件数/購入額/初回と最終の注文日時を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

public record CustomerOrderStats(
    long orderCount, BigDecimal totalSpent, Instant firstOrderDate, Instant lastOrderDate) {

  public static CustomerOrderStats empty() {
    return new CustomerOrderStats(0, BigDecimal.ZERO.setScale(2), null, null);
  }

  public BigDecimal averageOrderValue() {
    if (orderCount == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return totalSpent.divide(BigDecimal.valueOf(orderCount), 2, RoundingMode.HALF_UP);
  }

  public LoyaltyLevel loyaltyLevel() {
    return LoyaltyLevel.of(orderCount, totalSpent);
  }
}

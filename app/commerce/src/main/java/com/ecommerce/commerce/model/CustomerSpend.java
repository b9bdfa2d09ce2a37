/*
 * どこで: Commerce ドメインモデル
 * 何を: 顧客ごとの期間内の注文件数と購入額を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

/** 購入額ランキングの 1 行。 */
public record CustomerSpend(CustomerRecord customer, long orderCount, BigDecimal totalSpent) {

  public LoyaltyLevel loyaltyLevel() {
    return LoyaltyLevel.of(orderCount, totalSpent);
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 注文件数と購入額から顧客のロイヤルティ段階を導出する
 * なぜ: 顧客サマリとランキングで同じ閾値を使うため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

public enum LoyaltyLevel {
  NEW,
  BRONZE,
  SILVER,
  GOLD,
  PLATINUM;

  private static final BigDecimal SILVER_THRESHOLD = new BigDecimal("1000.00");
  private static final BigDecimal GOLD_THRESHOLD = new BigDecimal("5000.00");
  private static final BigDecimal PLATINUM_THRESHOLD = new BigDecimal("10000.00");

  public static LoyaltyLevel of(long orderCount, BigDecimal totalSpent) {
    if (orderCount == 0 || totalSpent == null) {
      return NEW;
    }
    if (totalSpent.compareTo(PLATINUM_THRESHOLD) >= 0) {
      return PLATINUM;
    }
    if (totalSpent.compareTo(GOLD_THRESHOLD) >= 0) {
      return GOLD;
    }
    if (totalSpent.compareTo(SILVER_THRESHOLD) >= 0) {
      return SILVER;
    }
    return BRONZE;
  }
}

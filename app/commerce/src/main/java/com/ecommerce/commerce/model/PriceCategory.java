/*
 * どこで: Commerce ドメインモデル
 * 何を: 商品価格から価格帯を導出する
 * なぜ: DB の計算列を持たず、アプリ側で一貫して算出するため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

public enum PriceCategory {
  BUDGET,
  STANDARD,
  PREMIUM,
  LUXURY;

  private static final BigDecimal BUDGET_LIMIT = new BigDecimal("50.00");
  private static final BigDecimal STANDARD_LIMIT = new BigDecimal("200.00");
  private static final BigDecimal PREMIUM_LIMIT = new BigDecimal("500.00");

  public static PriceCategory of(BigDecimal price) {
    if (price.compareTo(BUDGET_LIMIT) < 0) {
      return BUDGET;
    }
    if (price.compareTo(STANDARD_LIMIT) < 0) {
      return STANDARD;
    }
    if (price.compareTo(PREMIUM_LIMIT) < 0) {
      return PREMIUM;
    }
    return LUXURY;
  }
}

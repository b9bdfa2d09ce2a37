/*
 * どこで: Commerce ドメインモデル
 * 何を: products テーブルのスナップショットを表す
 * なぜ: 価格帯などの導出値を読み出し時に計算するため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductRecord(
    long productId,
    String name,
    String description,
    BigDecimal price,
    long categoryId,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {

  public PriceCategory priceCategory() {
    return PriceCategory.of(price);
  }
}

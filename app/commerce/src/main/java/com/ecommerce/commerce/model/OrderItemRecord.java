/*
 * どこで: Commerce ドメインモデル
 * 何を: order_items テーブルの 1 行を表す
 * なぜ: 明細金額を保存せず読み出し時に導出するため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderItemRecord(
    long orderItemId,
    long orderId,
    long productId,
    int quantity,
    BigDecimal unitPrice,
    Instant createdAt) {

  public BigDecimal lineTotal() {
    return unitPrice.multiply(BigDecimal.valueOf(quantity));
  }
}

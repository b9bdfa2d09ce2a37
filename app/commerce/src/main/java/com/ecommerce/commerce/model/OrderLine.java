/*
 * どこで: Commerce ドメインモデル
 * 何を: 注文作成時の明細入力 (商品/数量/単価) を表す
 * なぜ: 検証・金額計算・永続化へ同じ値を受け渡すため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

public record OrderLine(Long productId, Integer quantity, BigDecimal unitPrice) {

  public BigDecimal lineTotal() {
    return unitPrice.multiply(BigDecimal.valueOf(quantity));
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 商品検索の条件 (キーワード/カテゴリ/価格帯/並び順/ページ) を表す
 * なぜ: API のクエリ値をリポジトリへ型付きで渡すため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

public record ProductSearchCriteria(
    String term,
    Long categoryId,
    BigDecimal minPrice,
    BigDecimal maxPrice,
    ProductSortField sortBy,
    boolean descending,
    int page,
    int size) {

  /** ページ番号の検証後に呼ぶ。int に収まらない場合は ArithmeticException。 */
  public int offset() {
    return Math.multiplyExact(page - 1, size);
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 注文一覧の絞り込み条件 (顧客/ステータス/期間/最低金額/ページ) を表す
 * なぜ: API のクエリ値をリポジトリへ型付きで渡すため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderSearchCriteria(
    Long customerId,
    OrderStatus status,
    Instant from,
    Instant to,
    BigDecimal minAmount,
    int page,
    int size) {

  /** ページ番号の検証後に呼ぶ。int に収まらない場合は ArithmeticException。 */
  public int offset() {
    return Math.multiplyExact(page - 1, size);
  }
}

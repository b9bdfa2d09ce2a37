/*
 * どこで: Commerce ドメインモデル
 * 何を: 注文ステータスと許可される遷移を定義する
 * なぜ: 遷移規則を 1 箇所に集約し、サービスとテストで共有するため
 */
package com.ecommerce.commerce.model;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
  PENDING,
  PROCESSING,
  SHIPPED,
  DELIVERED,
  CANCELLED,
  REFUNDED;

  public Set<OrderStatus> allowedTargets() {
    return switch (this) {
      case PENDING -> EnumSet.of(PROCESSING, CANCELLED);
      case PROCESSING -> EnumSet.of(SHIPPED, CANCELLED);
      case SHIPPED -> EnumSet.of(DELIVERED, CANCELLED);
      case DELIVERED -> EnumSet.of(REFUNDED);
      case CANCELLED, REFUNDED -> EnumSet.noneOf(OrderStatus.class);
    };
  }

  public boolean canTransitionTo(OrderStatus target) {
    return target != null && allowedTargets().contains(target);
  }

  public boolean isCancellable() {
    return canTransitionTo(CANCELLED);
  }

  public boolean isTerminal() {
    return allowedTargets().isEmpty();
  }

  /** キャンセル/返金済みは購入額や売上に数えない。 */
  public boolean countsTowardSpend() {
    return this != CANCELLED && this != REFUNDED;
  }
}

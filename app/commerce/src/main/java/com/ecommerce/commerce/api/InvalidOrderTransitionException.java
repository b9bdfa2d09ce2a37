/*
 * どこで: Commerce API
 * 何を: 許可されていない注文ステータス遷移(409)を表す例外を定義する
 * なぜ: 状態機械の外への遷移を何も変更せずに拒否するため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderStatus;

public class InvalidOrderTransitionException extends RuntimeException {

  private final OrderStatus from;
  private final OrderStatus to;

  public InvalidOrderTransitionException(OrderStatus from, OrderStatus to) {
    this(from, to, "Cannot transition order from " + from + " to " + to);
  }

  protected InvalidOrderTransitionException(OrderStatus from, OrderStatus to, String message) {
    super(message);
    this.from = from;
    this.to = to;
  }

  public OrderStatus getFrom() {
    return from;
  }

  public OrderStatus getTo() {
    return to;
  }
}

/*
 * どこで: Commerce API
 * 何を: 同時に行われた別の遷移に負けたこと(409)を表す例外を定義する
 * なぜ: 読み取り後にステータスが変わった場合をクライアントが再読込で解決できるようにするため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderStatus;

public class OrderStatusConflictException extends RuntimeException {

  public OrderStatusConflictException(long orderId, OrderStatus expected) {
    super("Order " + orderId + " is no longer in status " + expected);
  }
}

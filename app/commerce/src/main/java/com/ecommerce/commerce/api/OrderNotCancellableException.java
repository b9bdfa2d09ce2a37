/*
 * どこで: Commerce API
 * 何を: キャンセルできない状態の注文へのキャンセル要求(409)を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderStatus;

public class OrderNotCancellableException extends InvalidOrderTransitionException {

  public OrderNotCancellableException(long orderId, OrderStatus current) {
    super(
        current,
        OrderStatus.CANCELLED,
        "Order " + orderId + " cannot be cancelled in status " + current);
  }
}

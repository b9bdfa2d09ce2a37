/*
 * どこで: Commerce API
 * 何を: Idempotency-Key 競合(409)を表す例外を定義する
 * なぜ: 同一キーで異なる注文内容が送られたことを検出するため
 */
package com.ecommerce.commerce.api;

public class IdempotencyConflictException extends RuntimeException {

  public IdempotencyConflictException(String message) {
    super(message);
  }
}

/*
 * どこで: Commerce API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.ecommerce.commerce.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  VALIDATION_FAILED,
  NOT_FOUND,
  INVALID_STATUS_TRANSITION,
  ORDER_NOT_CANCELLABLE,
  ORDER_STATUS_CONFLICT,
  IDEMPOTENCY_KEY_CONFLICT,
  CATALOG_CONFLICT,
  PERSISTENCE_ERROR
}

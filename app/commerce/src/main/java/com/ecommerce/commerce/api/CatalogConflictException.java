/*
 * どこで: Commerce API
 * 何を: カタログ更新の一意性違反 (409) を表す例外を定義する
 */
package com.ecommerce.commerce.api;

/** カタログの一意制約 (顧客メールアドレスなど) に反する登録/更新。 */
public class CatalogConflictException extends RuntimeException {

  public CatalogConflictException(String message) {
    super(message);
  }

  public CatalogConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}

/*
 * どこで: Commerce API
 * 何を: 注文書き込みの失敗(503)を表す例外を定義する
 * なぜ: どの段階で失敗したかを添えて、ロールバック済みであることを呼び出し元へ伝えるため
 */
package com.ecommerce.commerce.api;

public class OrderPersistenceException extends RuntimeException {

  private final String step;

  public OrderPersistenceException(String step, Throwable cause) {
    super("Failed to persist order at step " + step, cause);
    this.step = step;
  }

  public String getStep() {
    return step;
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 保存直後の注文ヘッダと明細の組を表す
 */
package com.ecommerce.commerce.model;

import java.util.List;

/** 1 トランザクションで書き込まれた注文ヘッダと明細。 */
public record PersistedOrder(OrderRecord order, List<OrderItemRecord> items) {
  public PersistedOrder {
    items = items == null ? List.of() : List.copyOf(items);
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: ページ単位の取得結果と総件数を表す
 */
package com.ecommerce.commerce.model;

import java.util.List;

/** リポジトリのページ取得結果。 */
public record PageResult<T>(List<T> items, long totalCount) {
  public PageResult {
    items = items == null ? List.of() : List.copyOf(items);
  }
}

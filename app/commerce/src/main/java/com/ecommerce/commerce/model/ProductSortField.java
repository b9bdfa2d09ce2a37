/*
 * どこで: Commerce ドメインモデル
 * 何を: 商品検索で指定できる並び順の列を表す
 * なぜ: クエリ値を SQL の列名へ直接埋め込まないため
 */
package com.ecommerce.commerce.model;

public enum ProductSortField {
  NAME("name"),
  PRICE("price"),
  CREATED_AT("created_at");

  private final String column;

  ProductSortField(String column) {
    this.column = column;
  }

  public String column() {
    return column;
  }
}

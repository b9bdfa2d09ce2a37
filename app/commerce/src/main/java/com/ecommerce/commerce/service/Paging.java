/*
 * どこで: Commerce サービス層
 * 何を: 1 始まりのページ番号とページサイズから OFFSET を求める
 */
package com.ecommerce.commerce.service;

final class Paging {

  private Paging() {}

  /** page は 1 始まり。範囲外や OFFSET が int に収まらない値は 400 として扱う。 */
  static int offset(int page, int size, int maxPageSize) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (size < 1 || size > maxPageSize) {
      throw new IllegalArgumentException("size must be between 1 and " + maxPageSize);
    }
    try {
      return Math.multiplyExact(page - 1, size);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("page is too large for size " + size, ex);
    }
  }
}

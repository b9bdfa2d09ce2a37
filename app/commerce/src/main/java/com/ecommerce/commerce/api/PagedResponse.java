/*
 * どこで: Commerce API
 * 何を: 一覧系エンドポイント共通のページング応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.PageResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.function.Function;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PagedResponse<T>(List<T> items, int page, int size, long totalCount, long totalPages) {

  public PagedResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static <R, T> PagedResponse<T> of(
      PageResult<R> result, int page, int size, Function<R, T> mapper) {
    final long totalPages = (result.totalCount() + size - 1) / size;
    return new PagedResponse<>(
        result.items().stream().map(mapper).toList(), page, size, result.totalCount(), totalPages);
  }
}

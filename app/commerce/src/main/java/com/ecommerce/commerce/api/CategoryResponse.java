/*
 * どこで: Commerce API
 * 何を: カテゴリの応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.CategoryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryResponse(
    long categoryId,
    String name,
    Long parentCategoryId,
    int displayOrder,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {

  public static CategoryResponse from(CategoryRecord category) {
    return new CategoryResponse(
        category.categoryId(),
        category.name(),
        category.parentCategoryId(),
        category.displayOrder(),
        category.active(),
        category.createdAt(),
        category.modifiedAt());
  }
}

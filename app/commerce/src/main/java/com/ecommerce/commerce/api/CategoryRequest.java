/*
 * どこで: Commerce API
 * 何を: カテゴリ登録/更新の入力を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryRequest(
    @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,
    Long parentCategoryId,
    @PositiveOrZero(message = "display_order must not be negative") Integer displayOrder) {}

/*
 * どこで: Commerce API
 * 何を: 商品の登録/更新リクエストを保持する
 * なぜ: 価格の範囲と桁をテーブルの CHECK と揃えて入口で弾くため
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProductRequest(
    @NotBlank(message = "name is required")
        @Size(max = 255, message = "name must be at most 255 characters")
        String name,
    String description,
    @NotNull(message = "price is required")
        @DecimalMin(value = "0.01", message = "price must be greater than 0")
        @DecimalMax(value = "999999.99", message = "price must be at most 999999.99")
        @Digits(integer = 6, fraction = 2, message = "price must have at most 2 decimal places")
        BigDecimal price,
    @NotNull(message = "category_id is required") Long categoryId) {}

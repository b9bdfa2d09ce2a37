/*
 * どこで: Commerce API
 * 何を: カテゴリ単位の一括価格改定の入力を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/** price_multiplier は 1.1 で 10% 値上げ、0.9 で 10% 値下げ。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkPriceUpdateRequest(
    @NotNull(message = "category_id is required") Long categoryId,
    @NotNull(message = "price_multiplier is required")
        @Positive(message = "price_multiplier must be greater than 0")
        @DecimalMax(value = "100", message = "price_multiplier must be at most 100")
        @Digits(
            integer = 3,
            fraction = 4,
            message = "price_multiplier must have at most 4 decimal places")
        BigDecimal priceMultiplier) {}

/*
 * どこで: Commerce API
 * 何を: 一括価格改定の結果を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkPriceUpdateResponse(
    long categoryId, BigDecimal priceMultiplier, int updatedCount) {}

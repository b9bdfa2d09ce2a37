/*
 * どこで: Commerce API
 * 何を: カテゴリの商品数と価格統計の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.CategoryPriceStats;
import com.ecommerce.commerce.model.CategoryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

/** 価格は有効な商品が無いカテゴリでは null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryStatisticsResponse(
    long categoryId,
    String name,
    boolean active,
    Instant createdAt,
    long productCount,
    BigDecimal averagePrice,
    BigDecimal minPrice,
    BigDecimal maxPrice) {

  public static CategoryStatisticsResponse from(
      CategoryRecord category, CategoryPriceStats stats) {
    return new CategoryStatisticsResponse(
        category.categoryId(),
        category.name(),
        category.active(),
        category.createdAt(),
        stats.productCount(),
        stats.averagePrice(),
        stats.minPrice(),
        stats.maxPrice());
  }
}

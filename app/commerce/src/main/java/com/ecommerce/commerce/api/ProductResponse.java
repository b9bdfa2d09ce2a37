/*
 * どこで: Commerce API
 * 何を: 商品の応答を表す
 * なぜ: 価格帯区分を保存せず応答時に価格から導くため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.PriceCategory;
import com.ecommerce.commerce.model.ProductRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProductResponse(
    long productId,
    String name,
    String description,
    BigDecimal price,
    PriceCategory priceCategory,
    long categoryId,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {

  public static ProductResponse from(ProductRecord product) {
    return new ProductResponse(
        product.productId(),
        product.name(),
        product.description(),
        product.price(),
        product.priceCategory(),
        product.categoryId(),
        product.active(),
        product.createdAt(),
        product.modifiedAt());
  }
}

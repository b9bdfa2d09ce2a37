/*
 * どこで: Commerce API
 * 何を: 商品の販売実績の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.ProductSales;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProductSalesResponse(
    long productId,
    String name,
    long categoryId,
    long orderCount,
    long unitsSold,
    BigDecimal revenue) {

  public static ProductSalesResponse from(ProductSales sales) {
    return new ProductSalesResponse(
        sales.productId(),
        sales.name(),
        sales.categoryId(),
        sales.orderCount(),
        sales.unitsSold(),
        sales.revenue());
  }
}

/*
 * どこで: Commerce API
 * 何を: 日次売上 1 日分の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.DailySales;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DailySalesResponse(
    LocalDate date, long orderCount, BigDecimal totalSales, BigDecimal averageOrderValue) {

  public static DailySalesResponse from(DailySales sales) {
    return new DailySalesResponse(
        sales.day(), sales.orderCount(), sales.totalSales(), sales.averageOrderValue());
  }
}

/*
 * どこで: Commerce API
 * 何を: 日次売上推移の応答を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** 売上の無い日は含まない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SalesTrendResponse(Instant from, int days, List<DailySalesResponse> points) {

  public SalesTrendResponse {
    points = points == null ? List.of() : List.copyOf(points);
  }
}

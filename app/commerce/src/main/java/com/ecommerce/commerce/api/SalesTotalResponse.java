/*
 * どこで: Commerce API
 * 何を: 期間内の売上合計の応答を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

/** 配送完了 (DELIVERED) 注文の合計金額。from/to は指定が無ければ null。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SalesTotalResponse(Instant from, Instant to, BigDecimal totalSales) {}

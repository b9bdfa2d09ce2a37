/*
 * どこで: Commerce API
 * 何を: 顧客の期間内の購入状況とロイヤルティ段階の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.LoyaltyLevel;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.Instant;

/** 注文が無い期間では日時系の値と days_since_last_order が null になる。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerOrderSummaryResponse(
    long customerId,
    String customerName,
    String email,
    int months,
    long totalOrders,
    BigDecimal totalSpent,
    BigDecimal averageOrderValue,
    Instant firstOrderDate,
    Instant lastOrderDate,
    Long daysSinceLastOrder,
    LoyaltyLevel loyaltyLevel) {}

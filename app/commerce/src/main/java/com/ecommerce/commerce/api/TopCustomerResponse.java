/*
 * どこで: Commerce API
 * 何を: 購入額ランキング 1 行の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.CustomerSpend;
import com.ecommerce.commerce.model.LoyaltyLevel;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TopCustomerResponse(
    long customerId,
    String customerName,
    String email,
    long orderCount,
    BigDecimal totalSpent,
    LoyaltyLevel loyaltyLevel) {

  public static TopCustomerResponse from(CustomerSpend spend) {
    return new TopCustomerResponse(
        spend.customer().customerId(),
        spend.customer().fullName(),
        spend.customer().email(),
        spend.orderCount(),
        spend.totalSpent(),
        spend.loyaltyLevel());
  }
}

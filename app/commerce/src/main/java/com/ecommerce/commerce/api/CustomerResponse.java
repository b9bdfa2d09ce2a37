/*
 * どこで: Commerce API
 * 何を: 顧客の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.CustomerRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustomerResponse(
    long customerId,
    String firstName,
    String lastName,
    String fullName,
    String email,
    String phone,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {

  public static CustomerResponse from(CustomerRecord customer) {
    return new CustomerResponse(
        customer.customerId(),
        customer.firstName(),
        customer.lastName(),
        customer.fullName(),
        customer.email(),
        customer.phone(),
        customer.active(),
        customer.createdAt(),
        customer.modifiedAt());
  }
}

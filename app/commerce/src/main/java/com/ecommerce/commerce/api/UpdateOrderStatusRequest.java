/*
 * どこで: Commerce API
 * 何を: 注文ステータス変更の入力を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UpdateOrderStatusRequest(@NotNull(message = "status is required") OrderStatus status) {}

/*
 * どこで: Commerce API
 * 何を: 注文キャンセルの入力 (任意の理由) を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelOrderRequest(
    @Size(max = 500, message = "reason must be at most 500 characters") String reason) {}

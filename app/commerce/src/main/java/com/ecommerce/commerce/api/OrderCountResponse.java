/*
 * どこで: Commerce API
 * 何を: ステータス別の注文件数の応答を表す
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderCountResponse(OrderStatus status, long count) {}

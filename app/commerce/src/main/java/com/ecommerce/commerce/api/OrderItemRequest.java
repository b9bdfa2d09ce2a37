/*
 * どこで: Commerce API
 * 何を: 注文明細 1 行の入力を表す
 * なぜ: 欠落や範囲外の値もそのまま受け取り、OrderValidator が行ごとの違反としてまとめて返すため
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrderItemRequest(Long productId, Integer quantity, BigDecimal unitPrice) {}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 注文の小計/税額/合計を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

/** 小計・税額・合計の組。total は常に subtotal + taxAmount。 */
public record OrderTotals(BigDecimal subtotal, BigDecimal taxAmount, BigDecimal totalAmount) {}

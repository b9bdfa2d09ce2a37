/*
 * どこで: Commerce ドメインモデル
 * 何を: orders テーブルのスナップショットを表す
 * なぜ: API 応答と監査スナップショットで共通化するため
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderRecord(
    long orderId,
    long customerId,
    Instant orderDate,
    BigDecimal subtotal,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    OrderStatus status,
    String shippingAddress,
    Instant createdAt,
    Instant modifiedAt) {}

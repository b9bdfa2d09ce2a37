/*
 * どこで: Commerce ドメインモデル
 * 何を: idempotency_keys テーブルの読込結果を表す
 * なぜ: 注文作成の再送時に保存済みレスポンスを再利用するため
 */
package com.ecommerce.commerce.model;

import java.time.Instant;

public record IdempotencyRecord(
    String idempotencyKey,
    String requestHash,
    int responseCode,
    String responseBodyJson,
    Instant expiresAt) {}

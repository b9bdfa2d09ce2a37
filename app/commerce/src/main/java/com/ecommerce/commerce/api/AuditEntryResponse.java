/*
 * どこで: Commerce API
 * 何を: 監査ログ 1 行の応答を表す
 * なぜ: 変更前後のスナップショットを文字列ではなく JSON のまま返すため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.AuditAction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEntryResponse(
    long auditId,
    String tableName,
    AuditAction action,
    Long recordId,
    String userId,
    Instant occurredAt,
    JsonNode oldValues,
    JsonNode newValues) {}

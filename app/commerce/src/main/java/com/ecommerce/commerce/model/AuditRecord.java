/*
 * どこで: Commerce ドメインモデル
 * 何を: audit_log テーブルの 1 行を表す
 * なぜ: 追記専用の監査記録を登録と参照で共通化するため
 */
package com.ecommerce.commerce.model;

import java.time.Instant;

public record AuditRecord(
    Long auditId,
    String tableName,
    AuditAction action,
    Long recordId,
    String userId,
    Instant occurredAt,
    String oldValuesJson,
    String newValuesJson) {}

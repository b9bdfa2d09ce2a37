/*
 * どこで: Commerce サービス層
 * 何を: 変更操作ごとに監査レコードを 1 件追記する
 * なぜ: 業務更新と監査を同じトランザクションで確定/破棄させるため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.AuditRecord;
import com.ecommerce.commerce.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class AuditRecorder {

  static final String SYSTEM_ACTOR = "system";

  private final AuditLogRepository auditLogRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** 呼び出し元のトランザクション内でのみ実行できる。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public long record(
      String tableName,
      AuditAction action,
      long recordId,
      String actor,
      Object oldValues,
      Object newValues) {
    final AuditRecord record =
        new AuditRecord(
            null,
            tableName,
            action,
            recordId,
            actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor,
            Instant.now(clock),
            toJson(oldValues),
            toJson(newValues));
    return auditLogRepository.insert(record);
  }

  private String toJson(Object values) {
    if (values == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize audit snapshot", ex);
    }
  }
}

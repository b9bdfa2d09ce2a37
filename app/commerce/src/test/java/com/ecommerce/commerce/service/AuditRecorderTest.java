/*
 * どこで: AuditRecorder の単体テスト
 * 何を: スナップショットの JSON 化と操作者の既定値を検証する
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.AuditRecord;
import com.ecommerce.commerce.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private AuditLogRepository auditLogRepository;

  @Test
  void serializesSnapshotsAndDefaultsActorToSystem() {
    final AuditRecorder recorder =
        new AuditRecorder(auditLogRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    when(auditLogRepository.insert(any())).thenReturn(99L);

    final long auditId =
        recorder.record(
            "orders",
            AuditAction.UPDATE,
            7L,
            " ",
            Map.of("status", "PENDING"),
            Map.of("status", "PROCESSING"));

    final ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
    verify(auditLogRepository).insert(captor.capture());
    final AuditRecord record = captor.getValue();
    assertThat(auditId).isEqualTo(99L);
    assertThat(record.userId()).isEqualTo("system");
    assertThat(record.occurredAt()).isEqualTo(NOW);
    assertThat(record.oldValuesJson()).isEqualTo("{\"status\":\"PENDING\"}");
    assertThat(record.newValuesJson()).isEqualTo("{\"status\":\"PROCESSING\"}");
  }

  @Test
  void keepsNullSnapshotForInsert() {
    final AuditRecorder recorder =
        new AuditRecorder(auditLogRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    when(auditLogRepository.insert(any())).thenReturn(1L);

    recorder.record("customers", AuditAction.INSERT, 3L, "admin", null, Map.of("email", "a@b.co"));

    final ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
    verify(auditLogRepository).insert(captor.capture());
    assertThat(captor.getValue().oldValuesJson()).isNull();
    assertThat(captor.getValue().userId()).isEqualTo("admin");
  }
}

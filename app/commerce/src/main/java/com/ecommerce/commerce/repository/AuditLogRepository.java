/*
 * どこで: Commerce データアクセス
 * 何を: audit_log への追記と参照を行う
 * なぜ: 監査記録を更新/削除させない追記専用の入口にするため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.AuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(AuditRecord record) {
    final String sql =
        """
        INSERT INTO audit_log (
          table_name,
          action,
          record_id,
          user_id,
          occurred_at,
          old_values,
          new_values
        ) VALUES (
          :tableName,
          :action,
          :recordId,
          :userId,
          :occurredAt,
          CAST(:oldValues AS jsonb),
          CAST(:newValues AS jsonb)
        )
        RETURNING audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tableName", record.tableName())
            .addValue("action", record.action().name())
            .addValue("recordId", record.recordId())
            .addValue("userId", record.userId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("oldValues", record.oldValuesJson())
            .addValue("newValues", record.newValuesJson());
    final Long auditId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (auditId == null) {
      throw new IllegalStateException("audit_log insert returned no id");
    }
    return auditId;
  }

  public List<AuditRecord> findByRecord(String tableName, long recordId) {
    final String sql =
        """
        SELECT audit_id, table_name, action, record_id, user_id, occurred_at,
               old_values::text AS old_values_text, new_values::text AS new_values_text
        FROM audit_log
        WHERE table_name = :tableName
          AND record_id = :recordId
        ORDER BY occurred_at, audit_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("tableName", tableName)
            .addValue("recordId", recordId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditRecord(
        rs.getLong("audit_id"),
        rs.getString("table_name"),
        AuditAction.valueOf(rs.getString("action")),
        rs.getObject("record_id", Long.class),
        rs.getString("user_id"),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getString("old_values_text"),
        rs.getString("new_values_text"));
  }
}

/*
 * どこで: Commerce データアクセス
 * 何を: idempotency_keys のロック/参照/保存/期限切れ削除を担う
 * なぜ: 注文作成の再送で同じ注文を二重に作らないため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.IdempotencyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class IdempotencyKeyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockByKey(long lockKey) {
    // 同一キーの注文作成をトランザクション終了まで直列化する。
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("lockKey", lockKey), rs -> null);
  }

  public Optional<IdempotencyRecord> findActive(String idempotencyKey, Instant now) {
    final String sql =
        """
        SELECT idem_key, request_hash, response_code, response_body::text AS response_body_text,
               expires_at
        FROM idempotency_keys
        WHERE idem_key = :idempotencyKey
          AND expires_at > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int upsertIfExpired(IdempotencyRecord record, Instant now) {
    final String sql =
        """
        INSERT INTO idempotency_keys (idem_key, request_hash, response_code, response_body, expires_at)
        VALUES (:idempotencyKey, :requestHash, :responseCode, CAST(:responseBody AS jsonb), :expiresAt)
        ON CONFLICT (idem_key) DO UPDATE
          SET request_hash  = EXCLUDED.request_hash,
              response_code = EXCLUDED.response_code,
              response_body = EXCLUDED.response_body,
              expires_at    = EXCLUDED.expires_at
        WHERE idempotency_keys.expires_at <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("idempotencyKey", record.idempotencyKey())
            .addValue("requestHash", record.requestHash())
            .addValue("responseCode", record.responseCode())
            .addValue("responseBody", record.responseBodyJson())
            .addValue("expiresAt", toTimestamp(record.expiresAt()))
            .addValue("now", toTimestamp(now));
    // 0 件なら有効期限内の記録が残っている。
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql = "DELETE FROM idempotency_keys WHERE expires_at <= :now";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new IdempotencyRecord(
        rs.getString("idem_key"),
        rs.getString("request_hash"),
        rs.getInt("response_code"),
        rs.getString("response_body_text"),
        rs.getTimestamp("expires_at").toInstant());
  }
}

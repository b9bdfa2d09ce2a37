/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と JDBC Timestamp の相互変換を行う
 * なぜ: PostgreSQL JDBC に型推論させず、UTC のまま明示的にバインドするため
 */
package com.ecommerce.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestamps {
  private JdbcTimestamps() {}

  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // NULL 許容カラム (modified_at など) をそのまま null として返す
  public static Instant readInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp timestamp = rs.getTimestamp(column);
    return timestamp == null ? null : timestamp.toInstant();
  }
}

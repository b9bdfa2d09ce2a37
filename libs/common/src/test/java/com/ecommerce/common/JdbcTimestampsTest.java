package com.ecommerce.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampsTest {

  @Test
  void convertsInstantWithoutShiftingTime() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30.123Z");

    assertThat(JdbcTimestamps.toTimestamp(instant).toInstant()).isEqualTo(instant);
    assertThat(JdbcTimestamps.toTimestamp(null)).isNull();
  }

  @Test
  void readsNullableColumnAsNull() throws SQLException {
    final ResultSet rs = mock(ResultSet.class);
    when(rs.getTimestamp("modified_at")).thenReturn(null);
    when(rs.getTimestamp("created_at"))
        .thenReturn(Timestamp.from(Instant.parse("2026-03-01T10:00:00Z")));

    assertThat(JdbcTimestamps.readInstant(rs, "modified_at")).isNull();
    assertThat(JdbcTimestamps.readInstant(rs, "created_at"))
        .isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
  }
}

/*
 * どこで: Commerce データアクセス
 * 何を: customers の登録/更新/無効化/再有効化/検索と購入額ランキングを行う
 * なぜ: 注文検証と顧客 API が同じ行表現を参照するため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.readInstant;
import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.CustomerSpend;
import com.ecommerce.commerce.model.PageResult;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustomerRepository {

  private static final String COLUMNS =
      "customer_id, first_name, last_name, email, phone, is_active, created_at, modified_at";

  private static final String PREFIXED_COLUMNS =
      "c.customer_id, c.first_name, c.last_name, c.email, c.phone, c.is_active, c.created_at,"
          + " c.modified_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CustomerRecord insert(
      String firstName, String lastName, String email, String phone, Instant createdAt) {
    final String sql =
        """
        INSERT INTO customers (first_name, last_name, email, phone, is_active, created_at)
        VALUES (:firstName, :lastName, :email, :phone, TRUE, :createdAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("firstName", firstName)
            .addValue("lastName", lastName)
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<CustomerRecord> findById(long customerId) {
    final String sql = "SELECT " + COLUMNS + " FROM customers WHERE customer_id = :customerId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("customerId", customerId), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<CustomerRecord> findByEmail(String email) {
    final String sql = "SELECT " + COLUMNS + " FROM customers WHERE lower(email) = lower(:email)";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("email", email), this::mapRow)
        .stream()
        .findFirst();
  }

  public Optional<CustomerRecord> update(
      long customerId,
      String firstName,
      String lastName,
      String email,
      String phone,
      Instant modifiedAt) {
    final String sql =
        """
        UPDATE customers
        SET first_name = :firstName,
            last_name = :lastName,
            email = :email,
            phone = :phone,
            modified_at = :modifiedAt
        WHERE customer_id = :customerId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("firstName", firstName)
            .addValue("lastName", lastName)
            .addValue("email", email)
            .addValue("phone", phone)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CustomerRecord> deactivate(long customerId, Instant modifiedAt) {
    // 既に無効なら更新しない。
    final String sql =
        """
        UPDATE customers
        SET is_active = FALSE,
            modified_at = :modifiedAt
        WHERE customer_id = :customerId
          AND is_active
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CustomerRecord> reactivate(long customerId, Instant modifiedAt) {
    final String sql =
        """
        UPDATE customers
        SET is_active = TRUE,
            modified_at = :modifiedAt
        WHERE customer_id = :customerId
          AND NOT is_active
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** since 以降に注文 (ステータス問わず) が 1 件も無い有効な顧客を登録順に返す。 */
  public PageResult<CustomerRecord> findWithoutOrdersSince(Instant since, int offset, int limit) {
    final String where =
        """
         WHERE c.is_active
           AND NOT EXISTS (
             SELECT 1 FROM orders o
             WHERE o.customer_id = c.customer_id
               AND o.order_date >= :since)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("since", toTimestamp(since))
            .addValue("offset", offset)
            .addValue("limit", limit);
    final List<CustomerRecord> items =
        jdbcTemplate.query(
            "SELECT "
                + PREFIXED_COLUMNS
                + " FROM customers c"
                + where
                + " ORDER BY c.created_at, c.customer_id OFFSET :offset LIMIT :limit",
            params,
            this::mapRow);
    final Long total =
        jdbcTemplate.queryForObject("SELECT count(*) FROM customers c" + where, params, Long.class);
    return new PageResult<>(items, total == null ? 0 : total);
  }

  /** 有効な顧客を since 以降の購入額の降順で返す。キャンセル/返金済みは除き、注文の無い顧客は含めない。 */
  public List<CustomerSpend> findTopSpenders(Instant since, int limit) {
    final String sql =
        "SELECT "
            + PREFIXED_COLUMNS
            + """
            , count(o.order_id) AS order_count,
              SUM(o.total_amount) AS total_spent
            FROM customers c
            JOIN orders o ON o.customer_id = c.customer_id
            WHERE c.is_active
              AND o.order_date >= :since
              AND o.status NOT IN
            """
            + OrderRepository.NON_SPEND_STATUSES
            + """

            GROUP BY c.customer_id
            ORDER BY total_spent DESC, c.customer_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new CustomerSpend(
                mapRow(rs, rowNum), rs.getLong("order_count"), rs.getBigDecimal("total_spent")));
  }

  public PageResult<CustomerRecord> search(String term, Boolean active, int offset, int limit) {
    final List<String> conditions = new ArrayList<>();
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (term != null && !term.isBlank()) {
      conditions.add(
          "(first_name ILIKE :pattern OR last_name ILIKE :pattern OR email ILIKE :pattern)");
      params.addValue("pattern", "%" + term.trim() + "%");
    }
    if (active != null) {
      conditions.add("is_active = :active");
      params.addValue("active", active);
    }
    final String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    params.addValue("offset", offset).addValue("limit", limit);

    final List<CustomerRecord> items =
        jdbcTemplate.query(
            "SELECT "
                + COLUMNS
                + " FROM customers"
                + where
                + " ORDER BY last_name, first_name, customer_id OFFSET :offset LIMIT :limit",
            params,
            this::mapRow);
    final Long total =
        jdbcTemplate.queryForObject("SELECT count(*) FROM customers" + where, params, Long.class);
    return new PageResult<>(items, total == null ? 0 : total);
  }

  private CustomerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CustomerRecord(
        rs.getLong("customer_id"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("email"),
        rs.getString("phone"),
        rs.getBoolean("is_active"),
        rs.getTimestamp("created_at").toInstant(),
        readInstant(rs, "modified_at"));
  }
}

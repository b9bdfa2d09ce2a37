/*
 * どこで: Commerce データアクセス
 * 何を: orders の登録/参照/条件付きステータス更新と売上/購入額の集計を行う
 * なぜ: 同一注文への同時遷移を compare-and-set で 1 件に絞るため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.readInstant;
import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.CustomerOrderStats;
import com.ecommerce.commerce.model.DailySales;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderSearchCriteria;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.model.PageResult;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OrderRepository {

  private static final String COLUMNS =
      """
      order_id, customer_id, order_date, subtotal, tax_amount, total_amount,
      status, shipping_address, created_at, modified_at
      """;

  /** 購入額/売上の集計から外すステータス。 */
  static final String NON_SPEND_STATUSES = "('CANCELLED', 'REFUNDED')";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OrderRecord insert(
      long customerId, OrderTotals totals, String shippingAddress, Instant orderDate) {
    final String sql =
        """
        INSERT INTO orders (
          customer_id,
          order_date,
          subtotal,
          tax_amount,
          total_amount,
          status,
          shipping_address,
          created_at
        ) VALUES (
          :customerId,
          :orderDate,
          :subtotal,
          :taxAmount,
          :totalAmount,
          :status,
          :shippingAddress,
          :orderDate
        )
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("customerId", customerId)
            .addValue("orderDate", toTimestamp(orderDate))
            .addValue("subtotal", totals.subtotal())
            .addValue("taxAmount", totals.taxAmount())
            .addValue("totalAmount", totals.totalAmount())
            .addValue("status", OrderStatus.PENDING.name())
            .addValue("shippingAddress", shippingAddress);
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<OrderRecord> findById(long orderId) {
    final String sql = "SELECT " + COLUMNS + " FROM orders WHERE order_id = :orderId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("orderId", orderId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<OrderRecord> updateStatusIfCurrent(
      long orderId, OrderStatus expected, OrderStatus target, Instant modifiedAt) {
    // 読み取った時点のステータスのままなら更新する。別トランザクションが先に更新していれば空。
    final String sql =
        """
        UPDATE orders
        SET status = :target,
            modified_at = :modifiedAt
        WHERE order_id = :orderId
          AND status = :expected
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", orderId)
            .addValue("expected", expected.name())
            .addValue("target", target.name())
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public PageResult<OrderRecord> findPage(OrderSearchCriteria criteria) {
    final List<String> conditions = new ArrayList<>();
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (criteria.customerId() != null) {
      conditions.add("customer_id = :customerId");
      params.addValue("customerId", criteria.customerId());
    }
    if (criteria.status() != null) {
      conditions.add("status = :status");
      params.addValue("status", criteria.status().name());
    }
    if (criteria.from() != null) {
      conditions.add("order_date >= :from");
      params.addValue("from", toTimestamp(criteria.from()));
    }
    if (criteria.to() != null) {
      conditions.add("order_date <= :to");
      params.addValue("to", toTimestamp(criteria.to()));
    }
    if (criteria.minAmount() != null) {
      conditions.add("total_amount >= :minAmount");
      params.addValue("minAmount", criteria.minAmount());
    }
    final String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    params.addValue("offset", criteria.offset()).addValue("limit", criteria.size());

    final List<OrderRecord> items =
        jdbcTemplate.query(
            "SELECT "
                + COLUMNS
                + " FROM orders"
                + where
                + " ORDER BY order_date DESC, order_id DESC OFFSET :offset LIMIT :limit",
            params,
            this::mapRow);
    final Long total =
        jdbcTemplate.queryForObject("SELECT count(*) FROM orders" + where, params, Long.class);
    return new PageResult<>(items, total == null ? 0 : total);
  }

  public List<OrderRecord> findByCustomer(long customerId, Instant from, Instant to) {
    final StringBuilder sql =
        new StringBuilder("SELECT " + COLUMNS + " FROM orders WHERE customer_id = :customerId");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    if (from != null) {
      sql.append(" AND order_date >= :from");
      params.addValue("from", toTimestamp(from));
    }
    if (to != null) {
      sql.append(" AND order_date <= :to");
      params.addValue("to", toTimestamp(to));
    }
    sql.append(" ORDER BY order_date DESC, order_id DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public long countByStatus(OrderStatus status) {
    final String sql = "SELECT count(*) FROM orders WHERE status = :status";
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("status", status.name()), Long.class);
    return count == null ? 0 : count;
  }

  public BigDecimal sumTotals(OrderStatus status, Instant from, Instant to) {
    final StringBuilder sql =
        new StringBuilder(
            "SELECT COALESCE(SUM(total_amount), 0) FROM orders WHERE status = :status");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", status.name());
    if (from != null) {
      sql.append(" AND order_date >= :from");
      params.addValue("from", toTimestamp(from));
    }
    if (to != null) {
      sql.append(" AND order_date <= :to");
      params.addValue("to", toTimestamp(to));
    }
    return jdbcTemplate.queryForObject(sql.toString(), params, BigDecimal.class);
  }

  /** 日付は UTC で区切る。 */
  public List<DailySales> dailySales(OrderStatus status, Instant from) {
    final String sql =
        """
        SELECT (order_date AT TIME ZONE 'UTC')::date AS day,
               count(*) AS order_count,
               SUM(total_amount) AS total_sales,
               ROUND(AVG(total_amount), 2) AS average_order_value
        FROM orders
        WHERE status = :status
          AND order_date >= :from
        GROUP BY day
        ORDER BY day
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("from", toTimestamp(from));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new DailySales(
                rs.getObject("day", LocalDate.class),
                rs.getLong("order_count"),
                rs.getBigDecimal("total_sales"),
                rs.getBigDecimal("average_order_value")));
  }

  /** キャンセル/返金済みの注文は数えない。since が null なら全期間。 */
  public CustomerOrderStats customerStats(long customerId, Instant since) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT count(*) AS order_count,
                   COALESCE(SUM(total_amount), 0.00) AS total_spent,
                   MIN(order_date) AS first_order_date,
                   MAX(order_date) AS last_order_date
            FROM orders
            WHERE customer_id = :customerId
              AND status NOT IN
            """);
    sql.append(NON_SPEND_STATUSES);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("customerId", customerId);
    if (since != null) {
      sql.append(" AND order_date >= :since");
      params.addValue("since", toTimestamp(since));
    }
    return jdbcTemplate.queryForObject(
        sql.toString(),
        params,
        (rs, rowNum) ->
            new CustomerOrderStats(
                rs.getLong("order_count"),
                rs.getBigDecimal("total_spent"),
                readInstant(rs, "first_order_date"),
                readInstant(rs, "last_order_date")));
  }

  private OrderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OrderRecord(
        rs.getLong("order_id"),
        rs.getLong("customer_id"),
        rs.getTimestamp("order_date").toInstant(),
        rs.getBigDecimal("subtotal"),
        rs.getBigDecimal("tax_amount"),
        rs.getBigDecimal("total_amount"),
        OrderStatus.valueOf(rs.getString("status")),
        rs.getString("shipping_address"),
        rs.getTimestamp("created_at").toInstant(),
        readInstant(rs, "modified_at"));
  }
}

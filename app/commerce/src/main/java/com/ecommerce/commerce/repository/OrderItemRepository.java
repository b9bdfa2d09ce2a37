/*
 * どこで: Commerce データアクセス
 * 何を: order_items の登録/参照を行う
 * なぜ: 注文ヘッダと同一トランザクションで明細を書き込むため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderLine;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OrderItemRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public OrderItemRecord insert(long orderId, OrderLine line, Instant createdAt) {
    final String sql =
        """
        INSERT INTO order_items (order_id, product_id, quantity, unit_price, created_at)
        VALUES (:orderId, :productId, :quantity, :unitPrice, :createdAt)
        RETURNING order_item_id, order_id, product_id, quantity, unit_price, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("orderId", orderId)
            .addValue("productId", line.productId())
            .addValue("quantity", line.quantity())
            .addValue("unitPrice", line.unitPrice())
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public List<OrderItemRecord> findByOrderId(long orderId) {
    final String sql =
        """
        SELECT order_item_id, order_id, product_id, quantity, unit_price, created_at
        FROM order_items
        WHERE order_id = :orderId
        ORDER BY order_item_id
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("orderId", orderId), this::mapRow);
  }

  public List<OrderItemRecord> findByOrderIds(Collection<Long> orderIds) {
    if (orderIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT order_item_id, order_id, product_id, quantity, unit_price, created_at
        FROM order_items
        WHERE order_id IN (:orderIds)
        ORDER BY order_id, order_item_id
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("orderIds", orderIds), this::mapRow);
  }

  private OrderItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OrderItemRecord(
        rs.getLong("order_item_id"),
        rs.getLong("order_id"),
        rs.getLong("product_id"),
        rs.getInt("quantity"),
        rs.getBigDecimal("unit_price"),
        rs.getTimestamp("created_at").toInstant());
  }
}

/*
 * どこで: Commerce データアクセス
 * 何を: categories の登録/更新/無効化/一覧を行う
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.readInstant;
import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.CategoryRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CategoryRepository {

  private static final String COLUMNS =
      "category_id, name, parent_category_id, display_order, is_active, created_at, modified_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public CategoryRecord insert(
      String name, Long parentCategoryId, int displayOrder, Instant createdAt) {
    final String sql =
        """
        INSERT INTO categories (name, parent_category_id, display_order, is_active, created_at)
        VALUES (:name, :parentCategoryId, :displayOrder, TRUE, :createdAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("parentCategoryId", parentCategoryId, Types.BIGINT)
            .addValue("displayOrder", displayOrder)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<CategoryRecord> findById(long categoryId) {
    final String sql = "SELECT " + COLUMNS + " FROM categories WHERE category_id = :categoryId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("categoryId", categoryId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<CategoryRecord> findAll(boolean activeOnly) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM categories"
            + (activeOnly ? " WHERE is_active" : "")
            + " ORDER BY display_order, name, category_id";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<CategoryRecord> update(
      long categoryId, String name, Long parentCategoryId, int displayOrder, Instant modifiedAt) {
    final String sql =
        """
        UPDATE categories
        SET name = :name,
            parent_category_id = :parentCategoryId,
            display_order = :displayOrder,
            modified_at = :modifiedAt
        WHERE category_id = :categoryId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("categoryId", categoryId)
            .addValue("name", name)
            .addValue("parentCategoryId", parentCategoryId, Types.BIGINT)
            .addValue("displayOrder", displayOrder)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<CategoryRecord> deactivate(long categoryId, Instant modifiedAt) {
    final String sql =
        """
        UPDATE categories
        SET is_active = FALSE,
            modified_at = :modifiedAt
        WHERE category_id = :categoryId
          AND is_active
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("categoryId", categoryId)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private CategoryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CategoryRecord(
        rs.getLong("category_id"),
        rs.getString("name"),
        rs.getObject("parent_category_id", Long.class),
        rs.getInt("display_order"),
        rs.getBoolean("is_active"),
        rs.getTimestamp("created_at").toInstant(),
        readInstant(rs, "modified_at"));
  }
}

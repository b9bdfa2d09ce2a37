/*
 * どこで: Commerce データアクセス
 * 何を: products の登録/更新/無効化/検索と販売実績/価格の集計を行う
 * なぜ: 検索条件と並び順をホワイトリストの列だけで組み立てるため
 */
package com.ecommerce.commerce.repository;

import static com.ecommerce.common.JdbcTimestamps.readInstant;
import static com.ecommerce.common.JdbcTimestamps.toTimestamp;

import com.ecommerce.commerce.model.CategoryPriceStats;
import com.ecommerce.commerce.model.PageResult;
import com.ecommerce.commerce.model.PriceChange;
import com.ecommerce.commerce.model.ProductRecord;
import com.ecommerce.commerce.model.ProductSales;
import com.ecommerce.commerce.model.ProductSearchCriteria;
import com.ecommerce.commerce.model.ProductSortField;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

  private static final String COLUMNS =
      "product_id, name, description, price, category_id, is_active, created_at, modified_at";

  // products の CHECK 制約と同じ範囲。
  static final BigDecimal MIN_PRICE = new BigDecimal("0.01");
  static final BigDecimal MAX_PRICE = new BigDecimal("999999.99");

  // (order_id, product_id) は一意なので count(*) が受注件数になる。
  private static final String SALES_SELECT =
      """
      SELECT p.product_id,
             p.name,
             p.category_id,
             count(*) AS order_count,
             SUM(oi.quantity) AS units_sold,
             SUM(oi.quantity * oi.unit_price) AS revenue
      FROM products p
      JOIN order_items oi ON oi.product_id = p.product_id
      JOIN orders o ON o.order_id = oi.order_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ProductRecord insert(
      String name, String description, BigDecimal price, long categoryId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO products (name, description, price, category_id, is_active, created_at)
        VALUES (:name, :description, :price, :categoryId, TRUE, :createdAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("description", description)
            .addValue("price", price)
            .addValue("categoryId", categoryId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ProductRecord> findById(long productId) {
    final String sql = "SELECT " + COLUMNS + " FROM products WHERE product_id = :productId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource().addValue("productId", productId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<ProductRecord> findByIds(Collection<Long> productIds) {
    if (productIds.isEmpty()) {
      return List.of();
    }
    final String sql = "SELECT " + COLUMNS + " FROM products WHERE product_id IN (:productIds)";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("productIds", productIds), this::mapRow);
  }

  public Optional<ProductRecord> update(
      long productId,
      String name,
      String description,
      BigDecimal price,
      long categoryId,
      Instant modifiedAt) {
    final String sql =
        """
        UPDATE products
        SET name = :name,
            description = :description,
            price = :price,
            category_id = :categoryId,
            modified_at = :modifiedAt
        WHERE product_id = :productId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("name", name)
            .addValue("description", description)
            .addValue("price", price)
            .addValue("categoryId", categoryId)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ProductRecord> deactivate(long productId, Instant modifiedAt) {
    final String sql =
        """
        UPDATE products
        SET is_active = FALSE,
            modified_at = :modifiedAt
        WHERE product_id = :productId
          AND is_active
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("productId", productId)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public PageResult<ProductRecord> search(ProductSearchCriteria criteria) {
    // 検索対象は有効な商品のみ。
    final List<String> conditions = new ArrayList<>();
    conditions.add("is_active");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (criteria.term() != null && !criteria.term().isBlank()) {
      conditions.add("(name ILIKE :pattern OR description ILIKE :pattern)");
      params.addValue("pattern", "%" + criteria.term().trim() + "%");
    }
    if (criteria.categoryId() != null) {
      conditions.add("category_id = :categoryId");
      params.addValue("categoryId", criteria.categoryId());
    }
    if (criteria.minPrice() != null) {
      conditions.add("price >= :minPrice");
      params.addValue("minPrice", criteria.minPrice());
    }
    if (criteria.maxPrice() != null) {
      conditions.add("price <= :maxPrice");
      params.addValue("maxPrice", criteria.maxPrice());
    }
    final String where = " WHERE " + String.join(" AND ", conditions);
    final ProductSortField sortBy =
        criteria.sortBy() == null ? ProductSortField.NAME : criteria.sortBy();
    final String orderBy =
        " ORDER BY " + sortBy.column() + (criteria.descending() ? " DESC" : " ASC") + ", product_id";
    params.addValue("offset", criteria.offset()).addValue("limit", criteria.size());

    final List<ProductRecord> items =
        jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM products" + where + orderBy + " OFFSET :offset LIMIT :limit",
            params,
            this::mapRow);
    final Long total =
        jdbcTemplate.queryForObject("SELECT count(*) FROM products" + where, params, Long.class);
    return new PageResult<>(items, total == null ? 0 : total);
  }

  /** 期間内に配送完了した注文の販売数量が多い順。無効化された商品は除く。 */
  public List<ProductSales> findTopSelling(Instant since, int limit) {
    final String sql =
        SALES_SELECT
            + """
            WHERE p.is_active
              AND o.status = 'DELIVERED'
              AND o.order_date >= :since
            GROUP BY p.product_id
            ORDER BY units_sold DESC, p.product_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapSales);
  }

  /** 期間内の注文 (キャンセル/返金済みを除く) の売上が多い順。categoryId が null なら全カテゴリ。 */
  public List<ProductSales> salesAnalysis(Long categoryId, Instant since) {
    final StringBuilder sql =
        new StringBuilder(SALES_SELECT)
            .append("WHERE o.order_date >= :since AND o.status NOT IN ")
            .append(OrderRepository.NON_SPEND_STATUSES);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    if (categoryId != null) {
      sql.append(" AND p.category_id = :categoryId");
      params.addValue("categoryId", categoryId);
    }
    sql.append(" GROUP BY p.product_id ORDER BY revenue DESC, p.product_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapSales);
  }

  /** 倍率を掛けて 2 桁に丸めた価格が許容範囲を外れる有効な商品の件数。 */
  public long countPricesOutOfRange(long categoryId, BigDecimal multiplier) {
    final String sql =
        """
        SELECT count(*)
        FROM products
        WHERE category_id = :categoryId
          AND is_active
          AND (ROUND(price * :multiplier, 2) < :minPrice
               OR ROUND(price * :multiplier, 2) > :maxPrice)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("categoryId", categoryId)
            .addValue("multiplier", multiplier)
            .addValue("minPrice", MIN_PRICE)
            .addValue("maxPrice", MAX_PRICE);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  /** カテゴリ内の有効な商品の価格に倍率を掛ける。対象行をロックしてから旧価格と新価格を返す。 */
  public List<PriceChange> multiplyPrices(
      long categoryId, BigDecimal multiplier, Instant modifiedAt) {
    final String sql =
        """
        WITH current_prices AS (
          SELECT product_id, price
          FROM products
          WHERE category_id = :categoryId
            AND is_active
          FOR UPDATE
        )
        UPDATE products p
        SET price = ROUND(current_prices.price * :multiplier, 2),
            modified_at = :modifiedAt
        FROM current_prices
        WHERE p.product_id = current_prices.product_id
        RETURNING p.product_id, current_prices.price AS old_price, p.price AS new_price
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("categoryId", categoryId)
            .addValue("multiplier", multiplier)
            .addValue("modifiedAt", toTimestamp(modifiedAt));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new PriceChange(
                rs.getLong("product_id"),
                rs.getBigDecimal("old_price"),
                rs.getBigDecimal("new_price")));
  }

  public CategoryPriceStats priceStats(long categoryId) {
    final String sql =
        """
        SELECT count(*) AS product_count,
               ROUND(AVG(price), 2) AS average_price,
               MIN(price) AS min_price,
               MAX(price) AS max_price
        FROM products
        WHERE category_id = :categoryId
          AND is_active
        """;
    return jdbcTemplate.queryForObject(
        sql,
        new MapSqlParameterSource().addValue("categoryId", categoryId),
        (rs, rowNum) ->
            new CategoryPriceStats(
                rs.getLong("product_count"),
                rs.getBigDecimal("average_price"),
                rs.getBigDecimal("min_price"),
                rs.getBigDecimal("max_price")));
  }

  private ProductSales mapSales(ResultSet rs, int rowNum) throws SQLException {
    return new ProductSales(
        rs.getLong("product_id"),
        rs.getString("name"),
        rs.getLong("category_id"),
        rs.getLong("order_count"),
        rs.getLong("units_sold"),
        rs.getBigDecimal("revenue"));
  }

  private ProductRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProductRecord(
        rs.getLong("product_id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getBigDecimal("price"),
        rs.getLong("category_id"),
        rs.getBoolean("is_active"),
        rs.getTimestamp("created_at").toInstant(),
        readInstant(rs, "modified_at"));
  }
}

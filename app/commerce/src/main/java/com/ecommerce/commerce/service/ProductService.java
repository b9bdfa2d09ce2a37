/*
 * どこで: Commerce サービス層
 * 何を: 商品の登録/参照/検索/更新/無効化/一括価格改定と販売実績の集計を担う
 * なぜ: 存在しない/無効なカテゴリへの紐付けを書き込み前に弾くため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.BulkPriceUpdateRequest;
import com.ecommerce.commerce.api.BulkPriceUpdateResponse;
import com.ecommerce.commerce.api.PagedResponse;
import com.ecommerce.commerce.api.ProductRequest;
import com.ecommerce.commerce.api.ProductResponse;
import com.ecommerce.commerce.api.ProductSalesResponse;
import com.ecommerce.commerce.api.ResourceNotFoundException;
import com.ecommerce.commerce.api.ValidationFailedException;
import com.ecommerce.commerce.config.OrderProperties;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.CategoryRecord;
import com.ecommerce.commerce.model.PriceChange;
import com.ecommerce.commerce.model.ProductRecord;
import com.ecommerce.commerce.model.ProductSearchCriteria;
import com.ecommerce.commerce.model.ValidationViolation;
import com.ecommerce.commerce.repository.CategoryRepository;
import com.ecommerce.commerce.repository.ProductRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class ProductService {

  private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

  static final String TABLE_PRODUCTS = "products";
  static final int MAX_DAYS = 3650;

  private final ProductRepository productRepository;
  private final CategoryRepository categoryRepository;
  private final AuditRecorder auditRecorder;
  private final OrderProperties orderProperties;
  private final Clock clock;

  @Transactional
  public ProductResponse create(ProductRequest request, String actor) {
    validateCategory(request.categoryId());
    final ProductRecord created =
        productRepository.insert(
            request.name().trim(),
            request.description(),
            request.price(),
            request.categoryId(),
            Instant.now(clock));
    final ProductResponse response = ProductResponse.from(created);
    auditRecorder.record(
        TABLE_PRODUCTS, AuditAction.INSERT, created.productId(), actor, null, response);
    return response;
  }

  @Transactional(readOnly = true)
  public ProductResponse get(long productId) {
    return ProductResponse.from(load(productId));
  }

  @Transactional(readOnly = true)
  public PagedResponse<ProductResponse> search(ProductSearchCriteria criteria) {
    Paging.offset(criteria.page(), criteria.size(), orderProperties.maxPageSize());
    if (criteria.minPrice() != null
        && criteria.maxPrice() != null
        && criteria.minPrice().compareTo(criteria.maxPrice()) > 0) {
      throw new IllegalArgumentException("min_price must not be greater than max_price");
    }
    return PagedResponse.of(
        productRepository.search(criteria),
        criteria.page(),
        criteria.size(),
        ProductResponse::from);
  }

  @Transactional
  public ProductResponse update(long productId, ProductRequest request, String actor) {
    final ProductRecord current = load(productId);
    validateCategory(request.categoryId());
    final ProductRecord updated =
        productRepository
            .update(
                productId,
                request.name().trim(),
                request.description(),
                request.price(),
                request.categoryId(),
                Instant.now(clock))
            .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
    final ProductResponse response = ProductResponse.from(updated);
    auditRecorder.record(
        TABLE_PRODUCTS,
        AuditAction.UPDATE,
        productId,
        actor,
        ProductResponse.from(current),
        response);
    return response;
  }

  @Transactional
  public ProductResponse deactivate(long productId, String actor) {
    final ProductRecord current = load(productId);
    if (!current.active()) {
      return ProductResponse.from(current);
    }
    return productRepository
        .deactivate(productId, Instant.now(clock))
        .map(
            updated -> {
              final ProductResponse response = ProductResponse.from(updated);
              auditRecorder.record(
                  TABLE_PRODUCTS,
                  AuditAction.DEACTIVATED,
                  productId,
                  actor,
                  ProductResponse.from(current),
                  response);
              return response;
            })
        .orElseGet(() -> ProductResponse.from(load(productId)));
  }

  /** 直近 days 日間に配送完了した注文の販売数量の上位。 */
  @Transactional(readOnly = true)
  public List<ProductSalesResponse> topSelling(int count, int days) {
    requireInRange("count", count, orderProperties.maxPageSize());
    requireInRange("days", days, MAX_DAYS);
    return productRepository.findTopSelling(daysBefore(days), count).stream()
        .map(ProductSalesResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public List<ProductSalesResponse> salesAnalysis(Long categoryId, int days) {
    requireInRange("days", days, MAX_DAYS);
    return productRepository.salesAnalysis(categoryId, daysBefore(days)).stream()
        .map(ProductSalesResponse::from)
        .toList();
  }

  /**
   * カテゴリ内の有効な商品の価格に倍率を掛け、2 桁に丸める。
   * 1 件でも価格の許容範囲を外れるなら何も更新しない。
   */
  @Transactional
  public BulkPriceUpdateResponse bulkUpdatePrices(BulkPriceUpdateRequest request, String actor) {
    final long categoryId = request.categoryId();
    final BigDecimal multiplier = request.priceMultiplier();
    validateCategory(categoryId);
    final long outOfRange = productRepository.countPricesOutOfRange(categoryId, multiplier);
    if (outOfRange > 0) {
      throw new ValidationFailedException(
          List.of(
              new ValidationViolation(
                  "price_multiplier",
                  categoryId,
                  outOfRange + " product price(s) would fall outside the allowed range")));
    }
    final List<PriceChange> changes =
        productRepository.multiplyPrices(categoryId, multiplier, Instant.now(clock)).stream()
            .sorted(Comparator.comparingLong(PriceChange::productId))
            .toList();
    for (PriceChange change : changes) {
      auditRecorder.record(
          TABLE_PRODUCTS,
          AuditAction.UPDATE,
          change.productId(),
          actor,
          Map.of("price", change.oldPrice()),
          Map.of("price", change.newPrice()));
    }
    logger.info(
        "bulk price update categoryId={} multiplier={} updated={}",
        categoryId,
        multiplier,
        changes.size());
    return new BulkPriceUpdateResponse(categoryId, multiplier, changes.size());
  }

  private void requireInRange(String name, int value, int max) {
    if (value < 1 || value > max) {
      throw new IllegalArgumentException(name + " must be between 1 and " + max);
    }
  }

  private Instant daysBefore(int days) {
    return Instant.now(clock).minus(Duration.ofDays(days));
  }

  private ProductRecord load(long productId) {
    return productRepository
        .findById(productId)
        .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
  }

  private void validateCategory(Long categoryId) {
    final Optional<CategoryRecord> category = categoryRepository.findById(categoryId);
    if (category.isEmpty() || !category.get().active()) {
      throw new ValidationFailedException(
          List.of(
              new ValidationViolation(
                  "category_id",
                  categoryId,
                  "Category with ID " + categoryId + " not found or inactive")));
    }
  }
}

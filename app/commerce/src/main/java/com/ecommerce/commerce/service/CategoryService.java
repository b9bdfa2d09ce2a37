/*
 * どこで: Commerce サービス層
 * 何を: カテゴリの登録/参照/一覧/更新/無効化と所属商品/価格統計の参照を担う
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.CategoryRequest;
import com.ecommerce.commerce.api.CategoryResponse;
import com.ecommerce.commerce.api.CategoryStatisticsResponse;
import com.ecommerce.commerce.api.PagedResponse;
import com.ecommerce.commerce.api.ProductResponse;
import com.ecommerce.commerce.api.ResourceNotFoundException;
import com.ecommerce.commerce.api.ValidationFailedException;
import com.ecommerce.commerce.config.OrderProperties;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.CategoryRecord;
import com.ecommerce.commerce.model.ProductSearchCriteria;
import com.ecommerce.commerce.model.ProductSortField;
import com.ecommerce.commerce.model.ValidationViolation;
import com.ecommerce.commerce.repository.CategoryRepository;
import com.ecommerce.commerce.repository.ProductRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CategoryService {

  static final String TABLE_CATEGORIES = "categories";

  private final CategoryRepository categoryRepository;
  private final ProductRepository productRepository;
  private final AuditRecorder auditRecorder;
  private final OrderProperties orderProperties;
  private final Clock clock;

  @Transactional
  public CategoryResponse create(CategoryRequest request, String actor) {
    validateParent(null, request.parentCategoryId());
    final CategoryRecord created =
        categoryRepository.insert(
            request.name().trim(),
            request.parentCategoryId(),
            displayOrder(request),
            Instant.now(clock));
    final CategoryResponse response = CategoryResponse.from(created);
    auditRecorder.record(
        TABLE_CATEGORIES, AuditAction.INSERT, created.categoryId(), actor, null, response);
    return response;
  }

  @Transactional(readOnly = true)
  public CategoryResponse get(long categoryId) {
    return CategoryResponse.from(load(categoryId));
  }

  @Transactional(readOnly = true)
  public List<CategoryResponse> list(boolean activeOnly) {
    return categoryRepository.findAll(activeOnly).stream().map(CategoryResponse::from).toList();
  }

  @Transactional
  public CategoryResponse update(long categoryId, CategoryRequest request, String actor) {
    final CategoryRecord current = load(categoryId);
    validateParent(categoryId, request.parentCategoryId());
    final CategoryRecord updated =
        categoryRepository
            .update(
                categoryId,
                request.name().trim(),
                request.parentCategoryId(),
                displayOrder(request),
                Instant.now(clock))
            .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
    final CategoryResponse response = CategoryResponse.from(updated);
    auditRecorder.record(
        TABLE_CATEGORIES,
        AuditAction.UPDATE,
        categoryId,
        actor,
        CategoryResponse.from(current),
        response);
    return response;
  }

  @Transactional
  public CategoryResponse deactivate(long categoryId, String actor) {
    final CategoryRecord current = load(categoryId);
    if (!current.active()) {
      return CategoryResponse.from(current);
    }
    return categoryRepository
        .deactivate(categoryId, Instant.now(clock))
        .map(
            updated -> {
              final CategoryResponse response = CategoryResponse.from(updated);
              auditRecorder.record(
                  TABLE_CATEGORIES,
                  AuditAction.DEACTIVATED,
                  categoryId,
                  actor,
                  CategoryResponse.from(current),
                  response);
              return response;
            })
        .orElseGet(() -> CategoryResponse.from(load(categoryId)));
  }

  /** カテゴリに属する有効な商品を名前順で返す。 */
  @Transactional(readOnly = true)
  public PagedResponse<ProductResponse> products(long categoryId, int page, int size) {
    load(categoryId);
    Paging.offset(page, size, orderProperties.maxPageSize());
    return PagedResponse.of(
        productRepository.search(
            new ProductSearchCriteria(
                null, categoryId, null, null, ProductSortField.NAME, false, page, size)),
        page,
        size,
        ProductResponse::from);
  }

  @Transactional(readOnly = true)
  public CategoryStatisticsResponse statistics(long categoryId) {
    final CategoryRecord category = load(categoryId);
    return CategoryStatisticsResponse.from(category, productRepository.priceStats(categoryId));
  }

  private CategoryRecord load(long categoryId) {
    return categoryRepository
        .findById(categoryId)
        .orElseThrow(() -> new ResourceNotFoundException("Category", categoryId));
  }

  private void validateParent(Long categoryId, Long parentCategoryId) {
    if (parentCategoryId == null) {
      return;
    }
    if (parentCategoryId.equals(categoryId)) {
      throw parentViolation(parentCategoryId, "Category cannot be its own parent");
    }
    Optional<CategoryRecord> ancestor = categoryRepository.findById(parentCategoryId);
    if (ancestor.isEmpty()) {
      throw parentViolation(
          parentCategoryId, "Category with ID " + parentCategoryId + " not found");
    }
    if (categoryId == null) {
      return;
    }
    // 親を辿って自分自身に戻るなら循環になる。既存データの循環でも止まるよう訪問済みを持つ。
    final Set<Long> visited = new HashSet<>();
    while (ancestor.isPresent() && visited.add(ancestor.get().categoryId())) {
      final Long next = ancestor.get().parentCategoryId();
      if (next == null) {
        return;
      }
      if (next.equals(categoryId)) {
        throw parentViolation(
            parentCategoryId, "Category cannot be placed under its own descendant");
      }
      ancestor = categoryRepository.findById(next);
    }
  }

  private ValidationFailedException parentViolation(Long parentCategoryId, String message) {
    return new ValidationFailedException(
        List.of(new ValidationViolation("parent_category_id", parentCategoryId, message)));
  }

  private int displayOrder(CategoryRequest request) {
    return request.displayOrder() == null ? 0 : request.displayOrder();
  }
}

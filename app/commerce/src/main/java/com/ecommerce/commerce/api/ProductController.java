/*
 * どこで: Commerce API
 * 何を: 商品の CRUD/検索/販売集計/一括価格改定のエンドポイントを提供する
 * なぜ: キーワード/カテゴリ/価格帯/並び順をクエリで受け取り検索条件へ変換するため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.ProductSearchCriteria;
import com.ecommerce.commerce.model.ProductSortField;
import com.ecommerce.commerce.service.ProductService;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/products")
@RequiredArgsConstructor
public class ProductController {

  private final ProductService productService;

  @PostMapping
  public ResponseEntity<ProductResponse> create(
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody ProductRequest request) {
    final ProductResponse response = productService.create(request, actor);
    return ResponseEntity.created(URI.create("/v1/products/" + response.productId()))
        .body(response);
  }

  @GetMapping("/{product_id}")
  public ProductResponse get(@PathVariable("product_id") long productId) {
    return productService.get(productId);
  }

  @GetMapping
  public PagedResponse<ProductResponse> search(
      @RequestParam(value = "q", required = false) String term,
      @RequestParam(value = "category_id", required = false) Long categoryId,
      @RequestParam(value = "min_price", required = false) BigDecimal minPrice,
      @RequestParam(value = "max_price", required = false) BigDecimal maxPrice,
      @RequestParam(value = "sort_by", defaultValue = "NAME") ProductSortField sortBy,
      @RequestParam(value = "sort_dir", defaultValue = "asc") String sortDirection,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "size", defaultValue = "20") int size) {
    return productService.search(
        new ProductSearchCriteria(
            term,
            categoryId,
            minPrice,
            maxPrice,
            sortBy,
            isDescending(sortDirection),
            page,
            size));
  }

  @PutMapping("/{product_id}")
  public ProductResponse update(
      @PathVariable("product_id") long productId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody ProductRequest request) {
    return productService.update(productId, request, actor);
  }

  @DeleteMapping("/{product_id}")
  public ProductResponse deactivate(
      @PathVariable("product_id") long productId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor) {
    return productService.deactivate(productId, actor);
  }

  @GetMapping("/top-selling")
  public List<ProductSalesResponse> topSelling(
      @RequestParam(value = "count", defaultValue = "10") int count,
      @RequestParam(value = "days", defaultValue = "30") int days) {
    return productService.topSelling(count, days);
  }

  @GetMapping("/sales-analysis")
  public List<ProductSalesResponse> salesAnalysis(
      @RequestParam(value = "category_id", required = false) Long categoryId,
      @RequestParam(value = "days", defaultValue = "90") int days) {
    return productService.salesAnalysis(categoryId, days);
  }

  @PatchMapping("/bulk-update-prices")
  public BulkPriceUpdateResponse bulkUpdatePrices(
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody BulkPriceUpdateRequest request) {
    return productService.bulkUpdatePrices(request, actor);
  }

  private boolean isDescending(String sortDirection) {
    if ("desc".equalsIgnoreCase(sortDirection)) {
      return true;
    }
    if ("asc".equalsIgnoreCase(sortDirection)) {
      return false;
    }
    throw new IllegalArgumentException("sort_dir must be asc or desc");
  }
}

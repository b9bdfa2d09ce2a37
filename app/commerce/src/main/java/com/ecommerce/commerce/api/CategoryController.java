/*
 * どこで: Commerce API
 * 何を: カテゴリの CRUD と所属商品/価格統計のエンドポイントを提供する
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.service.CategoryService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/categories")
@RequiredArgsConstructor
public class CategoryController {

  private final CategoryService categoryService;

  @PostMapping
  public ResponseEntity<CategoryResponse> create(
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody CategoryRequest request) {
    final CategoryResponse response = categoryService.create(request, actor);
    return ResponseEntity.created(URI.create("/v1/categories/" + response.categoryId()))
        .body(response);
  }

  @GetMapping("/{category_id}")
  public CategoryResponse get(@PathVariable("category_id") long categoryId) {
    return categoryService.get(categoryId);
  }

  @GetMapping
  public List<CategoryResponse> list(
      @RequestParam(value = "active_only", defaultValue = "true") boolean activeOnly) {
    return categoryService.list(activeOnly);
  }

  @GetMapping("/{category_id}/products")
  public PagedResponse<ProductResponse> products(
      @PathVariable("category_id") long categoryId,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "size", defaultValue = "20") int size) {
    return categoryService.products(categoryId, page, size);
  }

  @GetMapping("/{category_id}/statistics")
  public CategoryStatisticsResponse statistics(@PathVariable("category_id") long categoryId) {
    return categoryService.statistics(categoryId);
  }

  @PutMapping("/{category_id}")
  public CategoryResponse update(
      @PathVariable("category_id") long categoryId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody CategoryRequest request) {
    return categoryService.update(categoryId, request, actor);
  }

  @DeleteMapping("/{category_id}")
  public CategoryResponse deactivate(
      @PathVariable("category_id") long categoryId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor) {
    return categoryService.deactivate(categoryId, actor);
  }
}

/*
 * どこで: Category API のWeb層テスト
 * 何を: 統計/所属商品エンドポイントの応答を検証する
 */
package com.ecommerce.commerce.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ecommerce.commerce.service.CategoryService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CategoryController.class)
@Import(ApiExceptionHandler.class)
class CategoryControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CategoryService categoryService;

  @Test
  void statisticsOfEmptyCategoryHasNullPrices() throws Exception {
    when(categoryService.statistics(4L))
        .thenReturn(
            new CategoryStatisticsResponse(
                4L, "Books", true, Instant.parse("2026-01-01T00:00:00Z"), 0, null, null, null));

    mockMvc
        .perform(get("/v1/categories/4/statistics"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.product_count").value(0))
        .andExpect(jsonPath("$.average_price").isEmpty());
  }

  @Test
  void productsPassesPaging() throws Exception {
    when(categoryService.products(4L, 2, 5))
        .thenReturn(new PagedResponse<>(List.of(), 2, 5, 6, 2));

    mockMvc
        .perform(get("/v1/categories/4/products").param("page", "2").param("size", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_pages").value(2));
  }

  @Test
  void productsOfUnknownCategoryIsNotFound() throws Exception {
    when(categoryService.products(9L, 1, 20))
        .thenThrow(new ResourceNotFoundException("Category", 9L));

    mockMvc
        .perform(get("/v1/categories/9/products"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }
}

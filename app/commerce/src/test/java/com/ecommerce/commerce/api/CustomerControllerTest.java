/*
 * どこで: Customer API のWeb層テスト
 * 何を: 入力検証、購入状況/ランキング/再有効化エンドポイントの応答を検証する
 */
package com.ecommerce.commerce.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ecommerce.commerce.model.LoyaltyLevel;
import com.ecommerce.commerce.service.CustomerService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CustomerController.class)
@Import(ApiExceptionHandler.class)
class CustomerControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CustomerService customerService;

  @Test
  void createRejectsMissingEmail() throws Exception {
    mockMvc
        .perform(
            post("/v1/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"first_name\":\"Ada\",\"last_name\":\"Lovelace\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("email is required"));

    verifyNoInteractions(customerService);
  }

  @Test
  void createMapsDuplicateEmailToConflict() throws Exception {
    when(customerService.create(any(), any()))
        .thenThrow(new CatalogConflictException("Email ada@example.com is already registered"));

    mockMvc
        .perform(
            post("/v1/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"first_name": "Ada", "last_name": "Lovelace", "email": "ada@example.com"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CATALOG_CONFLICT"));
  }

  @Test
  void orderSummaryUsesTwelveMonthsByDefault() throws Exception {
    when(customerService.orderSummary(5L, 12))
        .thenReturn(
            new CustomerOrderSummaryResponse(
                5L,
                "Ada Lovelace",
                "ada@example.com",
                12,
                4,
                new BigDecimal("1200.00"),
                new BigDecimal("300.00"),
                Instant.parse("2025-06-01T00:00:00Z"),
                Instant.parse("2026-02-19T10:00:00Z"),
                10L,
                LoyaltyLevel.SILVER));

    mockMvc
        .perform(get("/v1/customers/5/order-summary"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_orders").value(4))
        .andExpect(jsonPath("$.average_order_value").value(300.00))
        .andExpect(jsonPath("$.loyalty_level").value("SILVER"));
  }

  @Test
  void topCustomersMapsInvalidCountToBadRequest() throws Exception {
    when(customerService.topCustomers(0, 12))
        .thenThrow(new IllegalArgumentException("count must be between 1 and 100"));

    mockMvc
        .perform(get("/v1/customers/top").param("count", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("count must be between 1 and 100"));
  }

  @Test
  void inactivePassesWindowAndPaging() throws Exception {
    when(customerService.inactive(30, 1, 20))
        .thenReturn(new PagedResponse<>(List.of(), 1, 20, 0, 0));

    mockMvc
        .perform(get("/v1/customers/inactive").param("days", "30"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items.length()").value(0));

    verify(customerService).inactive(30, 1, 20);
  }

  @Test
  void reactivatePassesActor() throws Exception {
    final Instant createdAt = Instant.parse("2026-01-01T00:00:00Z");
    when(customerService.reactivate(5L, "admin"))
        .thenReturn(
            new CustomerResponse(
                5L,
                "Ada",
                "Lovelace",
                "Ada Lovelace",
                "ada@example.com",
                null,
                true,
                createdAt,
                createdAt));

    mockMvc
        .perform(patch("/v1/customers/5/reactivate").header("X-User-Id", "admin"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.active").value(true));
  }
}

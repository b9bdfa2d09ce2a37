/*
 * どこで: OrderValidator の単体テスト
 * 何を: 顧客/商品/数量/単価/重複/金額上限の違反が全件まとめて報告されることを検証する
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

import com.ecommerce.commerce.api.ValidationFailedException;
import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.model.ProductRecord;
import com.ecommerce.commerce.model.ValidationViolation;
import com.ecommerce.commerce.repository.CatalogLookup;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderValidatorTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private CatalogLookup catalogLookup;

  @InjectMocks private OrderValidator validator;

  @Test
  void acceptsActiveCustomerAndProducts() {
    when(catalogLookup.findCustomer(1L)).thenReturn(Optional.of(customer(1L, true)));
    when(catalogLookup.findProducts(anyCollection()))
        .thenReturn(Map.of(10L, product(10L, true), 11L, product(11L, true)));

    assertThatCode(
            () ->
                validator.validate(
                    1L,
                    List.of(
                        new OrderLine(10L, 2, new BigDecimal("29.99")),
                        new OrderLine(11L, 1, new BigDecimal("9.99")))))
        .doesNotThrowAnyException();
  }

  @Test
  void reportsInactiveProduct() {
    when(catalogLookup.findCustomer(1L)).thenReturn(Optional.of(customer(1L, true)));
    when(catalogLookup.findProducts(anyCollection()))
        .thenReturn(Map.of(10L, product(10L, false)));

    assertThatThrownBy(
            () -> validator.validate(1L, List.of(new OrderLine(10L, 1, new BigDecimal("5.00")))))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessage("Product with ID 10 not found or inactive");
  }

  @Test
  void collectsEveryViolation() {
    when(catalogLookup.findCustomer(2L)).thenReturn(Optional.of(customer(2L, false)));
    when(catalogLookup.findProducts(anyCollection())).thenReturn(Map.of(10L, product(10L, true)));

    final List<OrderLine> lines =
        Arrays.asList(
            new OrderLine(10L, 0, new BigDecimal("5.00")),
            new OrderLine(99L, 1, new BigDecimal("-1.00")),
            null);

    final ValidationFailedException ex =
        (ValidationFailedException)
            catchThrowable(() -> validator.validate(2L, lines));

    assertThat(ex.getViolations())
        .extracting(ValidationViolation::field)
        .containsExactly(
            "customer_id",
            "items[0].quantity",
            "items[1].product_id",
            "items[1].unit_price",
            "items[2]");
    assertThat(ex.getViolations().get(0).message()).isEqualTo("Customer with ID 2 is not active");
    assertThat(ex.getViolations().get(1).message())
        .isEqualTo("Quantity must be greater than 0 for product 10");
    assertThat(ex.getViolations().get(2).reference()).isEqualTo(99L);
    assertThat(ex).hasMessage("5 validation errors");
  }

  @Test
  void rejectsMissingCustomerAndEmptyItems() {
    when(catalogLookup.findCustomer(5L)).thenReturn(Optional.empty());

    final ValidationFailedException ex =
        (ValidationFailedException)
            catchThrowable(() -> validator.validate(5L, List.of()));

    assertThat(ex.getViolations())
        .extracting(ValidationViolation::message)
        .containsExactly("Customer with ID 5 not found", "Order must contain at least one item");
  }

  @Test
  void rejectsSubCentUnitPrice() {
    stubActiveCatalog();

    final ValidationFailedException ex =
        (ValidationFailedException)
            catchThrowable(
                () ->
                    validator.validate(
                        1L, List.of(new OrderLine(10L, 1, new BigDecimal("0.004")))));

    assertThat(ex.getViolations())
        .extracting(ValidationViolation::field)
        .containsExactly("items[0].unit_price");
    assertThat(ex).hasMessage("Unit price must have at most 2 decimal places for product 10");
  }

  @Test
  void rejectsThreeDecimalUnitPriceThatWouldBeRoundedOnSave() {
    stubActiveCatalog();

    assertThatThrownBy(
            () ->
                validator.validate(
                    1L,
                    List.of(
                        new OrderLine(10L, 2, new BigDecimal("10.005")),
                        new OrderLine(11L, 1, new BigDecimal("1.50")))))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            ex ->
                assertThat(ex.getViolations())
                    .extracting(ValidationViolation::field)
                    .containsExactly("items[0].unit_price"));
  }

  @Test
  void acceptsTrailingZerosBeyondTwoDecimals() {
    stubActiveCatalog();

    assertThatCode(
            () ->
                validator.validate(
                    1L, List.of(new OrderLine(10L, 3, new BigDecimal("19.9900")))))
        .doesNotThrowAnyException();
  }

  @Test
  void rejectsLineTotalBeyondAmountColumn() {
    stubActiveCatalog();

    final ValidationFailedException ex =
        (ValidationFailedException)
            catchThrowable(
                () ->
                    validator.validate(
                        1L,
                        List.of(
                            new OrderLine(
                                10L, Integer.MAX_VALUE, new BigDecimal("99999999.99")))));

    assertThat(ex.getViolations()).hasSize(1);
    assertThat(ex.getViolations().get(0).field()).isEqualTo("items[0]");
    assertThat(ex.getViolations().get(0).message())
        .isEqualTo("Line total exceeds the maximum amount for product 10");
  }

  @Test
  void rejectsDuplicateProductLines() {
    stubActiveCatalog();

    final ValidationFailedException ex =
        (ValidationFailedException)
            catchThrowable(
                () ->
                    validator.validate(
                        1L,
                        List.of(
                            new OrderLine(10L, 1, new BigDecimal("5.00")),
                            new OrderLine(11L, 1, new BigDecimal("5.00")),
                            new OrderLine(10L, 2, new BigDecimal("5.00")))));

    assertThat(ex.getViolations()).hasSize(1);
    assertThat(ex.getViolations().get(0).field()).isEqualTo("items[2].product_id");
    assertThat(ex.getViolations().get(0).reference()).isEqualTo(10L);
    assertThat(ex).hasMessage("Product with ID 10 appears in more than one item");
  }

  @Test
  void rejectsOrderTotalBeyondAmountColumn() {
    final OrderTotals totals =
        new OrderTotals(
            new BigDecimal("9999999999999999.00"),
            new BigDecimal("824999999999999.92"),
            new BigDecimal("10824999999999998.92"));

    assertThatThrownBy(() -> validator.validateTotals(totals))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessage("Order total exceeds the maximum amount of 9999999999999999.99");
  }

  @Test
  void acceptsOrderTotalAtAmountColumnLimit() {
    final OrderTotals totals =
        new OrderTotals(
            new BigDecimal("9999999999999999.99"), BigDecimal.ZERO, OrderValidator.MAX_AMOUNT);

    assertThatCode(() -> validator.validateTotals(totals)).doesNotThrowAnyException();
  }

  private void stubActiveCatalog() {
    when(catalogLookup.findCustomer(1L)).thenReturn(Optional.of(customer(1L, true)));
    when(catalogLookup.findProducts(anyCollection()))
        .thenReturn(Map.of(10L, product(10L, true), 11L, product(11L, true)));
  }

  private CustomerRecord customer(long id, boolean active) {
    return new CustomerRecord(
        id, "Ada", "Lovelace", "ada" + id + "@example.com", null, active, CREATED_AT, null);
  }

  private ProductRecord product(long id, boolean active) {
    return new ProductRecord(
        id, "Product " + id, null, new BigDecimal("10.00"), 1L, active, CREATED_AT, null);
  }
}

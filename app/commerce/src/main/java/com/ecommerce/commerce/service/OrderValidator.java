/*
 * どこで: Commerce サービス層
 * 何を: 注文作成前に顧客/商品/数量/単価と金額の上限を検証する
 * なぜ: 行を書き込む前に全違反をまとめて返すため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.ValidationFailedException;
import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.model.ProductRecord;
import com.ecommerce.commerce.model.ValidationViolation;
import com.ecommerce.commerce.repository.CatalogLookup;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OrderValidator {

  /** NUMERIC(18,2) に収まる最大金額。 */
  static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999999999.99");

  private static final int MONEY_SCALE = 2;

  private final CatalogLookup catalogLookup;

  /**
   * 違反が 1 件でもあれば {@link ValidationFailedException} を投げる。読み取りのみで副作用はない。
   */
  public void validate(Long customerId, List<OrderLine> lines) {
    final List<ValidationViolation> violations = new ArrayList<>();
    validateCustomer(customerId, violations);
    if (lines == null || lines.isEmpty()) {
      violations.add(
          new ValidationViolation("items", null, "Order must contain at least one item"));
    } else {
      validateLines(lines, violations);
    }
    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }
  }

  /** 税込み合計が金額列の上限を超える注文を弾く。 */
  public void validateTotals(OrderTotals totals) {
    if (totals.totalAmount().compareTo(MAX_AMOUNT) > 0) {
      throw new ValidationFailedException(
          List.of(
              new ValidationViolation(
                  "items", null, "Order total exceeds the maximum amount of " + MAX_AMOUNT)));
    }
  }

  private void validateCustomer(Long customerId, List<ValidationViolation> violations) {
    if (customerId == null) {
      violations.add(new ValidationViolation("customer_id", null, "Customer ID is required"));
      return;
    }
    final Optional<CustomerRecord> customer = catalogLookup.findCustomer(customerId);
    if (customer.isEmpty()) {
      violations.add(
          new ValidationViolation(
              "customer_id", customerId, "Customer with ID " + customerId + " not found"));
    } else if (!customer.get().active()) {
      violations.add(
          new ValidationViolation(
              "customer_id", customerId, "Customer with ID " + customerId + " is not active"));
    }
  }

  private void validateLines(List<OrderLine> lines, List<ValidationViolation> violations) {
    final Set<Long> productIds = new LinkedHashSet<>();
    for (OrderLine line : lines) {
      if (line != null && line.productId() != null) {
        productIds.add(line.productId());
      }
    }
    final Map<Long, ProductRecord> products = catalogLookup.findProducts(productIds);

    final Set<Long> seen = new HashSet<>();
    for (int index = 0; index < lines.size(); index++) {
      final OrderLine line = lines.get(index);
      final String path = "items[" + index + "]";
      if (line == null) {
        violations.add(new ValidationViolation(path, null, "Order item is required"));
        continue;
      }
      final Long productId = line.productId();
      if (productId == null) {
        violations.add(
            new ValidationViolation(path + ".product_id", null, "Product ID is required"));
      } else if (!seen.add(productId)) {
        violations.add(
            new ValidationViolation(
                path + ".product_id",
                productId,
                "Product with ID " + productId + " appears in more than one item"));
      } else {
        final ProductRecord product = products.get(productId);
        if (product == null || !product.active()) {
          violations.add(
              new ValidationViolation(
                  path + ".product_id",
                  productId,
                  "Product with ID " + productId + " not found or inactive"));
        }
      }
      final boolean quantityValid = line.quantity() != null && line.quantity() > 0;
      if (!quantityValid) {
        violations.add(
            new ValidationViolation(
                path + ".quantity",
                productId,
                "Quantity must be greater than 0 for product " + describe(productId)));
      }
      final BigDecimal unitPrice = line.unitPrice();
      if (!isPositive(unitPrice)) {
        violations.add(
            new ValidationViolation(
                path + ".unit_price",
                productId,
                "Unit price must be greater than 0 for product " + describe(productId)));
      } else if (unitPrice.stripTrailingZeros().scale() > MONEY_SCALE) {
        // 保存時に丸められると作成時と再計算時の合計がずれる。
        violations.add(
            new ValidationViolation(
                path + ".unit_price",
                productId,
                "Unit price must have at most 2 decimal places for product "
                    + describe(productId)));
      } else if (quantityValid
          && unitPrice.multiply(BigDecimal.valueOf(line.quantity())).compareTo(MAX_AMOUNT) > 0) {
        violations.add(
            new ValidationViolation(
                path,
                productId,
                "Line total exceeds the maximum amount for product " + describe(productId)));
      }
    }
  }

  private boolean isPositive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }

  private String describe(Long productId) {
    return Objects.toString(productId, "(unknown)");
  }
}

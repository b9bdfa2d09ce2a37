/*
 * どこで: Commerce アプリの設定バインド
 * 何を: 税率/冪等性 TTL/一覧ページ上限を保持する
 * なぜ: 金額計算と再送保護の前提を起動時に検証するため
 */
package com.ecommerce.commerce.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "commerce.order")
@Validated
public record OrderProperties(
    @NotNull BigDecimal taxRate,
    @NotNull Duration idempotencyTtl,
    @NotNull @Positive Integer maxPageSize) {

  @AssertTrue(message = "commerce.order.tax-rate must be between 0 and 1")
  public boolean isTaxRateInRange() {
    return taxRate != null && taxRate.signum() >= 0 && taxRate.compareTo(BigDecimal.ONE) < 0;
  }

  @AssertTrue(message = "commerce.order.idempotency-ttl must be positive")
  public boolean isIdempotencyTtlPositive() {
    return idempotencyTtl != null && !idempotencyTtl.isZero() && !idempotencyTtl.isNegative();
  }
}

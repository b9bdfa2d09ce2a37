/*
 * どこで: Commerce 設定バインドのバリデーションテスト
 * 何を: commerce.order の必須値と範囲チェックを検証する
 * なぜ: 税率や TTL の設定ミスを起動時に検知するため
 */
package com.ecommerce.commerce.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class OrderPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextFailsWhenTaxRateIsMissing() {
    contextRunner
        .withPropertyValues("commerce.order.idempotency-ttl=24h", "commerce.order.max-page-size=100")
        .run(assertValidationFailure("taxRate"));
  }

  @Test
  void contextFailsWhenTaxRateIsNegative() {
    contextRunner
        .withPropertyValues(
            "commerce.order.tax-rate=-0.01",
            "commerce.order.idempotency-ttl=24h",
            "commerce.order.max-page-size=100")
        .run(assertValidationFailure("tax-rate"));
  }

  @Test
  void contextFailsWhenIdempotencyTtlIsZero() {
    contextRunner
        .withPropertyValues(
            "commerce.order.tax-rate=0.0825",
            "commerce.order.idempotency-ttl=0s",
            "commerce.order.max-page-size=100")
        .run(assertValidationFailure("idempotency-ttl"));
  }

  @Test
  void contextStartsWithValidValues() {
    contextRunner
        .withPropertyValues(
            "commerce.order.tax-rate=0.0825",
            "commerce.order.idempotency-ttl=24h",
            "commerce.order.max-page-size=100")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final OrderProperties properties = context.getBean(OrderProperties.class);
              assertThat(properties.taxRate()).isEqualByComparingTo(new BigDecimal("0.0825"));
              assertThat(properties.idempotencyTtl()).isEqualTo(Duration.ofHours(24));
              assertThat(properties.maxPageSize()).isEqualTo(100);
            });
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root = Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties(OrderProperties.class)
  static class TestConfiguration {}
}

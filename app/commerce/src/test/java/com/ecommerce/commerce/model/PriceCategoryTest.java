/*
 * どこで: PriceCategory の単体テスト
 * 何を: 価格帯の境界値を検証する
 */
package com.ecommerce.commerce.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PriceCategoryTest {

  @ParameterizedTest
  @CsvSource({
    "0.01, BUDGET",
    "49.99, BUDGET",
    "50.00, STANDARD",
    "199.99, STANDARD",
    "200, PREMIUM",
    "499.99, PREMIUM",
    "500.00, LUXURY",
    "999999.99, LUXURY"
  })
  void derivesCategoryFromPriceBoundaries(String price, PriceCategory expected) {
    assertThat(PriceCategory.of(new BigDecimal(price))).isEqualTo(expected);
  }
}

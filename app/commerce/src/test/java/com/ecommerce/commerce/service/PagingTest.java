/*
 * どこで: Paging の単体テスト
 * 何を: OFFSET の計算と範囲外入力の拒否を検証する
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PagingTest {

  @Test
  void computesOffsetFromOneBasedPage() {
    assertThat(Paging.offset(1, 20, 100)).isZero();
    assertThat(Paging.offset(3, 20, 100)).isEqualTo(40);
  }

  @Test
  void rejectsPageWhoseOffsetDoesNotFitInInt() {
    assertThatThrownBy(() -> Paging.offset(Integer.MAX_VALUE, 100, 100))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("page is too large for size 100")
        .hasCauseInstanceOf(ArithmeticException.class);
  }

  @Test
  void acceptsLargestPageThatStillFits() {
    final int page = Integer.MAX_VALUE / 100 + 1;

    assertThat(Paging.offset(page, 100, 100)).isEqualTo((page - 1) * 100);
  }

  @Test
  void rejectsPageBelowOne() {
    assertThatThrownBy(() -> Paging.offset(0, 20, 100))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("page must be at least 1");
  }

  @Test
  void rejectsSizeAboveLimit() {
    assertThatThrownBy(() -> Paging.offset(1, 101, 100))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("size must be between 1 and 100");
  }
}

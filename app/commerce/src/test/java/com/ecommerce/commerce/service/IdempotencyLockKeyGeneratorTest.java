/*
 * どこで: IdempotencyLockKeyGenerator の単体テスト
 * 何を: ロックキーの決定性を検証する
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IdempotencyLockKeyGeneratorTest {

  private final IdempotencyLockKeyGenerator generator = new IdempotencyLockKeyGenerator();

  @Test
  void sameKeyYieldsSameLock() {
    assertThat(generator.generate("order-1")).isEqualTo(generator.generate("order-1"));
  }

  @Test
  void differentKeysYieldDifferentLocks() {
    assertThat(generator.generate("order-1")).isNotEqualTo(generator.generate("order-2"));
  }
}

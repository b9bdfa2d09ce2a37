/*
 * どこで: Commerce retention サービス
 * 何を: 期限切れの idempotency_keys を削除する
 * なぜ: 再送保護に不要になった行でテーブルが肥大化しないようにするため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.repository.IdempotencyKeyRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class OrderRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(OrderRetentionService.class);

  private final IdempotencyKeyRepository idempotencyKeyRepository;
  private final Clock clock;

  @Transactional
  public int cleanup() {
    final Instant now = Instant.now(clock);
    // 注文と監査は保持対象外。期限切れの冪等キーだけを消す。
    final int deleted = idempotencyKeyRepository.deleteExpired(now);
    logger.info("commerce retention cleanup deleted idempotencyKeys={} threshold={}", deleted, now);
    return deleted;
  }
}

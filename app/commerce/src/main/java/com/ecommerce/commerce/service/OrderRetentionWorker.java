/*
 * どこで: Commerce retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 */
package com.ecommerce.commerce.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "commerce.retention.enabled", havingValue = "true")
public class OrderRetentionWorker {

  private final OrderRetentionService retentionService;

  @Scheduled(fixedDelayString = "${commerce.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}

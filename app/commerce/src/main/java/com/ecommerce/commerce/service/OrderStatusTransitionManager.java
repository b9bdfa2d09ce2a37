/*
 * どこで: Commerce サービス層
 * 何を: 注文ステータスの遷移可否を判定し、条件付き更新と監査を行う
 * なぜ: 同じ注文への排他的な遷移が同時に来ても 1 件だけを成立させるため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.InvalidOrderTransitionException;
import com.ecommerce.commerce.api.OrderNotCancellableException;
import com.ecommerce.commerce.api.OrderStatusConflictException;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.repository.OrderRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class OrderStatusTransitionManager {

  private static final Logger logger = LoggerFactory.getLogger(OrderStatusTransitionManager.class);

  static final String TABLE_ORDERS = "orders";

  private final OrderRepository orderRepository;
  private final AuditRecorder auditRecorder;
  private final OrderMetrics orderMetrics;
  private final Clock clock;

  @Transactional(propagation = Propagation.MANDATORY)
  public OrderRecord transition(OrderRecord current, OrderStatus target, String actor) {
    if (!current.status().canTransitionTo(target)) {
      if (target == OrderStatus.CANCELLED) {
        throw new OrderNotCancellableException(current.orderId(), current.status());
      }
      throw new InvalidOrderTransitionException(current.status(), target);
    }
    final OrderRecord updated = compareAndSet(current, target);
    auditRecorder.record(
        TABLE_ORDERS,
        target == OrderStatus.CANCELLED ? AuditAction.CANCELLED : AuditAction.UPDATE,
        current.orderId(),
        actor,
        statusSnapshot(current.status(), null),
        statusSnapshot(updated.status(), null));
    orderMetrics.recordTransition(current.status(), updated.status());
    return updated;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public OrderRecord cancel(OrderRecord current, String reason, String actor) {
    if (!current.status().isCancellable()) {
      throw new OrderNotCancellableException(current.orderId(), current.status());
    }
    final OrderRecord updated = compareAndSet(current, OrderStatus.CANCELLED);
    auditRecorder.record(
        TABLE_ORDERS,
        AuditAction.CANCELLED,
        current.orderId(),
        actor,
        statusSnapshot(current.status(), null),
        statusSnapshot(updated.status(), reason));
    orderMetrics.recordTransition(current.status(), updated.status());
    return updated;
  }

  private OrderRecord compareAndSet(OrderRecord current, OrderStatus target) {
    final Instant now = Instant.now(clock);
    return orderRepository
        .updateStatusIfCurrent(current.orderId(), current.status(), target, now)
        .map(
            updated -> {
              logger.info(
                  "order status changed orderId={} from={} to={}",
                  current.orderId(),
                  current.status(),
                  target);
              return updated;
            })
        .orElseThrow(
            () -> {
              logger.warn(
                  "order status changed concurrently orderId={} expected={} target={}",
                  current.orderId(),
                  current.status(),
                  target);
              return new OrderStatusConflictException(current.orderId(), current.status());
            });
  }

  private Map<String, Object> statusSnapshot(OrderStatus status, String reason) {
    final Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("status", status.name());
    if (reason != null && !reason.isBlank()) {
      snapshot.put("reason", reason);
    }
    return snapshot;
  }
}

/*
 * どこで: OrderStatusTransitionManager の単体テスト
 * 何を: 遷移拒否/条件付き更新の競合/監査記録を検証する
 * なぜ: 拒否時は何も書かず、成立時は監査が 1 件だけ残ることを保証するため
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ecommerce.commerce.api.InvalidOrderTransitionException;
import com.ecommerce.commerce.api.OrderNotCancellableException;
import com.ecommerce.commerce.api.OrderStatusConflictException;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.repository.OrderRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderStatusTransitionManagerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private OrderRepository orderRepository;
  @Mock private AuditRecorder auditRecorder;
  @Mock private OrderMetrics orderMetrics;

  private OrderStatusTransitionManager manager;

  @BeforeEach
  void setUp() {
    manager =
        new OrderStatusTransitionManager(
            orderRepository, auditRecorder, orderMetrics, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void transitionUpdatesAndRecordsAudit() {
    final OrderRecord current = order(OrderStatus.PENDING);
    when(orderRepository.updateStatusIfCurrent(
            7L, OrderStatus.PENDING, OrderStatus.PROCESSING, NOW))
        .thenReturn(Optional.of(order(OrderStatus.PROCESSING)));

    final OrderRecord updated = manager.transition(current, OrderStatus.PROCESSING, "clerk");

    assertThat(updated.status()).isEqualTo(OrderStatus.PROCESSING);
    verify(auditRecorder)
        .record(
            "orders",
            AuditAction.UPDATE,
            7L,
            "clerk",
            Map.of("status", "PENDING"),
            Map.of("status", "PROCESSING"));
    verify(orderMetrics).recordTransition(OrderStatus.PENDING, OrderStatus.PROCESSING);
  }

  @Test
  void transitionRejectsSkippingStatesWithoutWriting() {
    assertThatThrownBy(
            () -> manager.transition(order(OrderStatus.PENDING), OrderStatus.DELIVERED, "clerk"))
        .isInstanceOf(InvalidOrderTransitionException.class)
        .hasMessage("Cannot transition order from PENDING to DELIVERED");

    verifyNoInteractions(orderRepository, auditRecorder);
  }

  @Test
  void transitionToCancelledFromDeliveredIsNotCancellable() {
    assertThatThrownBy(
            () -> manager.transition(order(OrderStatus.DELIVERED), OrderStatus.CANCELLED, "clerk"))
        .isInstanceOf(OrderNotCancellableException.class);

    verifyNoInteractions(orderRepository, auditRecorder);
  }

  @Test
  void transitionRaisesConflictWhenStatusChangedConcurrently() {
    when(orderRepository.updateStatusIfCurrent(
            7L, OrderStatus.SHIPPED, OrderStatus.DELIVERED, NOW))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> manager.transition(order(OrderStatus.SHIPPED), OrderStatus.DELIVERED, "clerk"))
        .isInstanceOf(OrderStatusConflictException.class)
        .hasMessage("Order 7 is no longer in status SHIPPED");

    verify(auditRecorder, never())
        .record(any(), any(), anyLong(), any(), any(), any());
  }

  @Test
  void cancelRecordsReasonInAudit() {
    when(orderRepository.updateStatusIfCurrent(
            7L, OrderStatus.PROCESSING, OrderStatus.CANCELLED, NOW))
        .thenReturn(Optional.of(order(OrderStatus.CANCELLED)));

    manager.cancel(order(OrderStatus.PROCESSING), "customer request", "clerk");

    verify(auditRecorder)
        .record(
            eq("orders"),
            eq(AuditAction.CANCELLED),
            eq(7L),
            eq("clerk"),
            eq(Map.of("status", "PROCESSING")),
            eq(Map.of("status", "CANCELLED", "reason", "customer request")));
  }

  @Test
  void cancelRejectsCancelledOrder() {
    assertThatThrownBy(() -> manager.cancel(order(OrderStatus.CANCELLED), "again", "clerk"))
        .isInstanceOf(OrderNotCancellableException.class)
        .hasMessage("Order 7 cannot be cancelled in status CANCELLED");
  }

  private OrderRecord order(OrderStatus status) {
    return new OrderRecord(
        7L,
        1L,
        NOW,
        new BigDecimal("69.97"),
        new BigDecimal("5.77"),
        new BigDecimal("75.74"),
        status,
        null,
        NOW,
        null);
  }
}

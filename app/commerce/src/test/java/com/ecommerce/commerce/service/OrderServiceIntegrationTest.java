/*
 * どこで: Commerce サービス層の結合テスト
 * 何を: 実 Postgres 上で注文作成の原子性/状態遷移と監査/同時遷移/冪等キーを検証する
 * なぜ: 制約違反やロールバック、条件付き更新の挙動は DB なしでは確認できないため
 */
package com.ecommerce.commerce.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ecommerce.commerce.AbstractPostgresContainerTest;
import com.ecommerce.commerce.api.AuditEntryResponse;
import com.ecommerce.commerce.api.AuditTrailResponse;
import com.ecommerce.commerce.api.CreateOrderRequest;
import com.ecommerce.commerce.api.IdempotencyConflictException;
import com.ecommerce.commerce.api.InvalidOrderTransitionException;
import com.ecommerce.commerce.api.OrderCreatedResponse;
import com.ecommerce.commerce.api.OrderItemRequest;
import com.ecommerce.commerce.api.OrderPersistenceException;
import com.ecommerce.commerce.api.OrderResponse;
import com.ecommerce.commerce.api.OrderStatusConflictException;
import com.ecommerce.commerce.api.ValidationFailedException;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.repository.CategoryRepository;
import com.ecommerce.commerce.repository.CustomerRepository;
import com.ecommerce.commerce.repository.ProductRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class OrderServiceIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private OrderService orderService;
  @Autowired private OrderPersister orderPersister;
  @Autowired private CustomerRepository customerRepository;
  @Autowired private CategoryRepository categoryRepository;
  @Autowired private ProductRepository productRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private long customerId;
  private long bookId;
  private long penId;

  @BeforeEach
  void setUp() {
    for (String table :
        List.of(
            "audit_log",
            "idempotency_keys",
            "order_items",
            "orders",
            "products",
            "categories",
            "customers")) {
      jdbcTemplate.update("DELETE FROM commerce." + table, new MapSqlParameterSource());
    }
    final Instant now = Instant.now();
    customerId =
        customerRepository.insert("Ada", "Lovelace", "ada@example.com", null, now).customerId();
    final long categoryId = categoryRepository.insert("Stationery", null, 0, now).categoryId();
    bookId =
        productRepository
            .insert("Notebook", null, new BigDecimal("29.99"), categoryId, now)
            .productId();
    penId =
        productRepository.insert("Pen", null, new BigDecimal("9.99"), categoryId, now).productId();
  }

  @Test
  void createsOrderWithTotalsItemsAndAudit() {
    final OrderCreatedResponse created =
        orderService.createOrder(
            request(item(bookId, 2, "29.99"), item(penId, 1, "9.99")), "clerk", null);

    assertThat(created.subtotal()).isEqualByComparingTo("69.97");
    assertThat(created.taxAmount()).isEqualByComparingTo("5.77");
    assertThat(created.totalAmount()).isEqualByComparingTo("75.74");
    assertThat(created.status()).isEqualTo(OrderStatus.PENDING);

    final OrderResponse order = orderService.getOrder(created.orderId());
    assertThat(order.items()).hasSize(2);

    final AuditTrailResponse audit = orderService.listAudit(created.orderId());
    assertThat(audit.entries()).hasSize(1);
    assertThat(audit.entries().get(0).action()).isEqualTo(AuditAction.INSERT);
    assertThat(audit.entries().get(0).userId()).isEqualTo("clerk");
    assertThat(audit.entries().get(0).newValues().get("items").size()).isEqualTo(2);
  }

  @Test
  void failingItemRollsBackWholeOrder() {
    final OrderTotals totals =
        new OrderTotals(
            new BigDecimal("69.97"), new BigDecimal("5.77"), new BigDecimal("75.74"));

    // 同一商品の 3 行目で一意制約違反になる
    assertThatThrownBy(
            () ->
                orderPersister.persist(
                    customerId,
                    "1 Main St",
                    List.of(
                        new OrderLine(bookId, 1, new BigDecimal("29.99")),
                        new OrderLine(penId, 1, new BigDecimal("9.99")),
                        new OrderLine(bookId, 1, new BigDecimal("29.99"))),
                    totals,
                    Instant.now()))
        .isInstanceOfSatisfying(
            OrderPersistenceException.class,
            ex -> assertThat(ex.getStep()).isEqualTo("insert_item[2]"));

    assertThat(count("orders")).isZero();
    assertThat(count("order_items")).isZero();
  }

  @Test
  void duplicateProductLinesAreRejectedBeforeWriting() {
    assertThatThrownBy(
            () ->
                orderService.createOrder(
                    request(
                        item(bookId, 1, "29.99"),
                        item(penId, 1, "9.99"),
                        item(bookId, 1, "29.99")),
                    "clerk",
                    null))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            ex ->
                assertThat(ex.getViolations())
                    .singleElement()
                    .satisfies(v -> assertThat(v.field()).isEqualTo("items[2].product_id")));

    assertThat(count("orders")).isZero();
    assertThat(count("audit_log")).isZero();
  }

  @Test
  void inactiveProductWritesNothing() {
    productRepository.deactivate(penId, Instant.now());

    assertThatThrownBy(
            () ->
                orderService.createOrder(
                    request(item(bookId, 1, "29.99"), item(penId, 1, "9.99")), "clerk", null))
        .isInstanceOfSatisfying(
            ValidationFailedException.class,
            ex ->
                assertThat(ex.getViolations())
                    .singleElement()
                    .satisfies(v -> assertThat(v.field()).isEqualTo("items[1].product_id")));

    assertThat(count("orders")).isZero();
  }

  @Test
  void walksLifecycleWithOneAuditRowPerTransition() {
    final long orderId = createSimpleOrder(null);

    orderService.updateOrderStatus(orderId, OrderStatus.PROCESSING, "clerk");
    orderService.updateOrderStatus(orderId, OrderStatus.SHIPPED, "clerk");
    orderService.updateOrderStatus(orderId, OrderStatus.DELIVERED, "clerk");
    final OrderResponse refunded =
        orderService.updateOrderStatus(orderId, OrderStatus.REFUNDED, "clerk");

    assertThat(refunded.status()).isEqualTo(OrderStatus.REFUNDED);
    assertThat(
            orderService.listAudit(orderId).entries().stream()
                .map(AuditEntryResponse::action)
                .toList())
        .containsExactly(
            AuditAction.INSERT,
            AuditAction.UPDATE,
            AuditAction.UPDATE,
            AuditAction.UPDATE,
            AuditAction.UPDATE);
    assertThatThrownBy(() -> orderService.cancelOrder(orderId, "late", "clerk"))
        .isInstanceOf(InvalidOrderTransitionException.class);
    assertThat(orderService.listAudit(orderId).entries()).hasSize(5);
  }

  @Test
  void cancelKeepsReasonInAudit() {
    final long orderId = createSimpleOrder(null);

    final OrderResponse cancelled = orderService.cancelOrder(orderId, "changed mind", "ada");

    assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
    final AuditEntryResponse last = orderService.listAudit(orderId).entries().get(1);
    assertThat(last.action()).isEqualTo(AuditAction.CANCELLED);
    assertThat(last.newValues().get("reason").asText()).isEqualTo("changed mind");
  }

  @Test
  void concurrentExclusiveTransitionsLetExactlyOneWin() throws Exception {
    final long orderId = createSimpleOrder(null);
    orderService.updateOrderStatus(orderId, OrderStatus.PROCESSING, "clerk");
    orderService.updateOrderStatus(orderId, OrderStatus.SHIPPED, "clerk");
    final int auditBefore = orderService.listAudit(orderId).entries().size();

    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final List<Callable<OrderResponse>> tasks =
          List.of(
              () -> {
                start.await();
                return orderService.updateOrderStatus(orderId, OrderStatus.DELIVERED, "courier");
              },
              () -> {
                start.await();
                return orderService.cancelOrder(orderId, "lost", "support");
              });
      final List<Future<OrderResponse>> futures = new ArrayList<>();
      for (Callable<OrderResponse> task : tasks) {
        futures.add(executor.submit(task));
      }
      start.countDown();

      int succeeded = 0;
      final List<Throwable> failures = new ArrayList<>();
      for (Future<OrderResponse> future : futures) {
        try {
          future.get(30, TimeUnit.SECONDS);
          succeeded++;
        } catch (ExecutionException ex) {
          failures.add(ex.getCause());
        }
      }

      assertThat(succeeded).isEqualTo(1);
      assertThat(failures)
          .singleElement()
          .isInstanceOfAny(
              OrderStatusConflictException.class, InvalidOrderTransitionException.class);
    } finally {
      executor.shutdownNow();
    }

    assertThat(orderService.listAudit(orderId).entries()).hasSize(auditBefore + 1);
    assertThat(orderService.getOrder(orderId).status())
        .isIn(OrderStatus.DELIVERED, OrderStatus.CANCELLED);
  }

  @Test
  void replaysSameIdempotencyKeyWithoutNewRows() {
    final CreateOrderRequest request = request(item(bookId, 2, "29.99"));

    final OrderCreatedResponse first = orderService.createOrder(request, "clerk", "idem-1");
    final OrderCreatedResponse second =
        orderService.createOrder(request(item(bookId, 2, "29.990")), "clerk", "idem-1");

    assertThat(second.orderId()).isEqualTo(first.orderId());
    assertThat(second.totalAmount()).isEqualByComparingTo(first.totalAmount());
    assertThat(count("orders")).isEqualTo(1);
    assertThat(count("audit_log")).isEqualTo(1);
  }

  @Test
  void rejectsIdempotencyKeyReusedForDifferentOrder() {
    orderService.createOrder(request(item(bookId, 2, "29.99")), "clerk", "idem-2");

    assertThatThrownBy(
            () -> orderService.createOrder(request(item(penId, 1, "9.99")), "clerk", "idem-2"))
        .isInstanceOf(IdempotencyConflictException.class);

    assertThat(count("orders")).isEqualTo(1);
  }

  @Test
  void failedCreationDoesNotConsumeIdempotencyKey() {
    productRepository.deactivate(penId, Instant.now());
    assertThatThrownBy(
            () -> orderService.createOrder(request(item(penId, 1, "9.99")), "clerk", "idem-3"))
        .isInstanceOf(ValidationFailedException.class);

    assertThat(count("idempotency_keys")).isZero();
  }

  private long createSimpleOrder(String idempotencyKey) {
    return orderService
        .createOrder(request(item(bookId, 1, "29.99")), "clerk", idempotencyKey)
        .orderId();
  }

  private CreateOrderRequest request(OrderItemRequest... items) {
    return new CreateOrderRequest(customerId, "1 Main St", List.of(items));
  }

  private OrderItemRequest item(long productId, int quantity, String unitPrice) {
    return new OrderItemRequest(productId, quantity, new BigDecimal(unitPrice));
  }

  private long count(String table) {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM commerce." + table, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }
}

/*
 * どこで: Commerce サービス層
 * 何を: 注文の作成/ステータス変更/キャンセル/再計算/参照/履歴/売上推移を担う
 * なぜ: 検証・計算・書き込み・監査・冪等性を 1 トランザクションで整合させるため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.AuditEntryResponse;
import com.ecommerce.commerce.api.AuditTrailResponse;
import com.ecommerce.commerce.api.CreateOrderRequest;
import com.ecommerce.commerce.api.CustomerOrderHistoryResponse;
import com.ecommerce.commerce.api.DailySalesResponse;
import com.ecommerce.commerce.api.IdempotencyConflictException;
import com.ecommerce.commerce.api.OrderCountResponse;
import com.ecommerce.commerce.api.OrderCreatedResponse;
import com.ecommerce.commerce.api.OrderHistoryEntryResponse;
import com.ecommerce.commerce.api.OrderItemRequest;
import com.ecommerce.commerce.api.OrderResponse;
import com.ecommerce.commerce.api.OrderSummaryResponse;
import com.ecommerce.commerce.api.OrderTotalsResponse;
import com.ecommerce.commerce.api.PagedResponse;
import com.ecommerce.commerce.api.ResourceNotFoundException;
import com.ecommerce.commerce.api.SalesTotalResponse;
import com.ecommerce.commerce.api.SalesTrendResponse;
import com.ecommerce.commerce.config.OrderProperties;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.AuditRecord;
import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.IdempotencyRecord;
import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderSearchCriteria;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.model.PersistedOrder;
import com.ecommerce.commerce.repository.AuditLogRepository;
import com.ecommerce.commerce.repository.CatalogLookup;
import com.ecommerce.commerce.repository.IdempotencyKeyRepository;
import com.ecommerce.commerce.repository.OrderItemRepository;
import com.ecommerce.commerce.repository.OrderRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
@RequiredArgsConstructor
public class OrderService {

  private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

  static final String TABLE_ORDERS = "orders";
  private static final String ACTION_CREATE = "create";
  private static final String ACTION_UPDATE_STATUS = "update_status";
  private static final String ACTION_CANCEL = "cancel";
  private static final String RESULT_SUCCESS = "success";
  private static final String RESULT_FAILURE = "failure";
  private static final int CREATED_STATUS_CODE = HttpStatus.CREATED.value();
  static final int MAX_TREND_DAYS = 365;

  private final OrderValidator orderValidator;
  private final OrderTotalCalculator totalCalculator;
  private final OrderPersister orderPersister;
  private final OrderStatusTransitionManager transitionManager;
  private final AuditRecorder auditRecorder;
  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;
  private final AuditLogRepository auditLogRepository;
  private final IdempotencyKeyRepository idempotencyKeyRepository;
  private final CatalogLookup catalogLookup;
  private final IdempotencyLockKeyGenerator lockKeyGenerator;
  private final RequestHasher requestHasher;
  private final OrderMetrics orderMetrics;
  private final ObjectMapper objectMapper;
  private final OrderProperties orderProperties;
  private final Clock clock;

  @Transactional
  public OrderCreatedResponse createOrder(
      CreateOrderRequest request, String actor, String idempotencyKey) {
    return recordCommand(
        ACTION_CREATE,
        () ->
            idempotencyKey == null || idempotencyKey.isBlank()
                ? placeOrder(request, actor)
                : placeOrderIdempotently(request, actor, idempotencyKey.trim()));
  }

  @Transactional
  public OrderResponse updateOrderStatus(long orderId, OrderStatus target, String actor) {
    return recordCommand(
        ACTION_UPDATE_STATUS,
        () -> {
          final OrderRecord current = loadOrder(orderId);
          final OrderRecord updated = transitionManager.transition(current, target, actor);
          return OrderResponse.from(updated, orderItemRepository.findByOrderId(orderId));
        });
  }

  @Transactional
  public OrderResponse cancelOrder(long orderId, String reason, String actor) {
    return recordCommand(
        ACTION_CANCEL,
        () -> {
          final OrderRecord current = loadOrder(orderId);
          final OrderRecord cancelled = transitionManager.cancel(current, reason, actor);
          logger.info("order cancelled orderId={} reason={}", orderId, reason);
          return OrderResponse.from(cancelled, orderItemRepository.findByOrderId(orderId));
        });
  }

  @Transactional(readOnly = true)
  public OrderTotalsResponse calculateOrderTotal(long orderId) {
    loadOrder(orderId);
    final List<OrderItemRecord> items = orderItemRepository.findByOrderId(orderId);
    return OrderTotalsResponse.of(orderId, items.size(), totalCalculator.calculateForItems(items));
  }

  @Transactional(readOnly = true)
  public OrderResponse getOrder(long orderId) {
    final OrderRecord order = loadOrder(orderId);
    return OrderResponse.from(order, orderItemRepository.findByOrderId(orderId));
  }

  @Transactional(readOnly = true)
  public PagedResponse<OrderSummaryResponse> listOrders(OrderSearchCriteria criteria) {
    Paging.offset(criteria.page(), criteria.size(), orderProperties.maxPageSize());
    requireOrderedRange(criteria.from(), criteria.to());
    if (criteria.minAmount() != null && criteria.minAmount().signum() < 0) {
      throw new IllegalArgumentException("min_amount must not be negative");
    }
    return PagedResponse.of(
        orderRepository.findPage(criteria),
        criteria.page(),
        criteria.size(),
        OrderSummaryResponse::from);
  }

  /** 顧客の注文履歴を新しい順に返す。includeItems のときだけ明細を付ける。 */
  @Transactional(readOnly = true)
  public CustomerOrderHistoryResponse customerHistory(
      long customerId, Instant from, Instant to, boolean includeItems) {
    requireOrderedRange(from, to);
    final CustomerRecord customer =
        catalogLookup
            .findCustomer(customerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    final List<OrderRecord> orders = orderRepository.findByCustomer(customerId, from, to);
    final Map<Long, List<OrderItemRecord>> itemsByOrder =
        includeItems
            ? orderItemRepository
                .findByOrderIds(orders.stream().map(OrderRecord::orderId).toList())
                .stream()
                .collect(Collectors.groupingBy(OrderItemRecord::orderId))
            : Map.of();
    final List<OrderHistoryEntryResponse> entries =
        orders.stream()
            .map(
                order ->
                    OrderHistoryEntryResponse.from(
                        order,
                        includeItems
                            ? itemsByOrder.getOrDefault(order.orderId(), List.of())
                            : null))
            .toList();
    final BigDecimal totalSpent =
        orders.stream()
            .filter(order -> order.status().countsTowardSpend())
            .map(OrderRecord::totalAmount)
            .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    return new CustomerOrderHistoryResponse(
        customerId, customer.fullName(), from, to, entries.size(), totalSpent, entries);
  }

  /** 直近 days 日間の配送完了注文を UTC 日付ごとに集計する。 */
  @Transactional(readOnly = true)
  public SalesTrendResponse salesTrends(int days) {
    if (days < 1 || days > MAX_TREND_DAYS) {
      throw new IllegalArgumentException("days must be between 1 and " + MAX_TREND_DAYS);
    }
    final Instant from = Instant.now(clock).minus(Duration.ofDays(days));
    final List<DailySalesResponse> points =
        orderRepository.dailySales(OrderStatus.DELIVERED, from).stream()
            .map(DailySalesResponse::from)
            .toList();
    return new SalesTrendResponse(from, days, points);
  }

  @Transactional(readOnly = true)
  public OrderCountResponse countByStatus(OrderStatus status) {
    return new OrderCountResponse(status, orderRepository.countByStatus(status));
  }

  @Transactional(readOnly = true)
  public SalesTotalResponse totalSales(Instant from, Instant to) {
    requireOrderedRange(from, to);
    final BigDecimal total = orderRepository.sumTotals(OrderStatus.DELIVERED, from, to);
    return new SalesTotalResponse(from, to, total);
  }

  @Transactional(readOnly = true)
  public AuditTrailResponse listAudit(long orderId) {
    loadOrder(orderId);
    final List<AuditEntryResponse> entries =
        auditLogRepository.findByRecord(TABLE_ORDERS, orderId).stream()
            .map(this::toAuditEntry)
            .toList();
    return new AuditTrailResponse(orderId, entries);
  }

  private OrderCreatedResponse placeOrderIdempotently(
      CreateOrderRequest request, String actor, String idempotencyKey) {
    final String requestHash = requestHasher.hash(request);
    // 同一 Idempotency-Key の同時実行を直列化し、ロック取得後に保存済み応答を確認する。
    idempotencyKeyRepository.lockByKey(lockKeyGenerator.generate(idempotencyKey));
    final Optional<IdempotencyRecord> existing =
        idempotencyKeyRepository.findActive(idempotencyKey, Instant.now(clock));
    if (existing.isPresent()) {
      return reuseIdempotentResponse(existing.get(), requestHash, idempotencyKey);
    }
    final OrderCreatedResponse response = placeOrder(request, actor);
    // 失敗した作成はロールバックされるため、保存されるのは成功応答だけになる。
    storeIdempotency(idempotencyKey, requestHash, response);
    return response;
  }

  private OrderCreatedResponse placeOrder(CreateOrderRequest request, String actor) {
    final List<OrderLine> lines = toLines(request.items());
    orderValidator.validate(request.customerId(), lines);
    final OrderTotals totals = totalCalculator.calculate(lines);
    orderValidator.validateTotals(totals);
    final Instant now = Instant.now(clock);
    final PersistedOrder persisted =
        orderPersister.persist(request.customerId(), request.shippingAddress(), lines, totals, now);
    final OrderRecord order = persisted.order();
    auditRecorder.record(
        TABLE_ORDERS, AuditAction.INSERT, order.orderId(), actor, null, snapshot(persisted));
    orderMetrics.recordOrderAmount(order.totalAmount());
    logger.info(
        "order created orderId={} customerId={} items={} total={}",
        order.orderId(),
        order.customerId(),
        persisted.items().size(),
        order.totalAmount());
    return OrderCreatedResponse.from(order);
  }

  private OrderCreatedResponse reuseIdempotentResponse(
      IdempotencyRecord record, String requestHash, String idempotencyKey) {
    if (!record.requestHash().equals(requestHash)) {
      throw new IdempotencyConflictException(
          "Idempotency-Key " + idempotencyKey + " was used with a different request");
    }
    if (record.responseCode() != CREATED_STATUS_CODE) {
      throw new IllegalStateException(
          "unsupported idempotency response code: " + record.responseCode());
    }
    try {
      final OrderCreatedResponse response =
          objectMapper.readValue(record.responseBodyJson(), OrderCreatedResponse.class);
      logger.info(
          "order creation replayed idempotencyKey={} orderId={}",
          idempotencyKey,
          response.orderId());
      return response;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse idempotency response", ex);
    }
  }

  private void storeIdempotency(
      String idempotencyKey, String requestHash, OrderCreatedResponse response) {
    final Instant now = Instant.now(clock);
    try {
      final IdempotencyRecord record =
          new IdempotencyRecord(
              idempotencyKey,
              requestHash,
              CREATED_STATUS_CODE,
              objectMapper.writeValueAsString(response),
              now.plus(orderProperties.idempotencyTtl()));
      if (idempotencyKeyRepository.upsertIfExpired(record, now) == 0) {
        // ロック下で未登録を確認済みのため、ここで衝突するのは不変条件違反。
        throw new IllegalStateException("idempotency invariant violated");
      }
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize idempotency response", ex);
    }
  }

  /**
   * コマンドの成否を記録する。トランザクション同期中はコミット/ロールバックの確定後に数えるため、
   * コミット時の失敗も failure になる。
   */
  private <T> T recordCommand(String action, Supplier<T> command) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
              orderMetrics.recordCommand(
                  action, status == STATUS_COMMITTED ? RESULT_SUCCESS : RESULT_FAILURE);
            }
          });
      return command.get();
    }
    try {
      final T result = command.get();
      orderMetrics.recordCommand(action, RESULT_SUCCESS);
      return result;
    } catch (RuntimeException ex) {
      orderMetrics.recordCommand(action, RESULT_FAILURE);
      throw ex;
    }
  }

  private void requireOrderedRange(Instant from, Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("from must not be after to");
    }
  }

  private OrderRecord loadOrder(long orderId) {
    return orderRepository
        .findById(orderId)
        .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
  }

  private List<OrderLine> toLines(List<OrderItemRequest> items) {
    if (items == null) {
      return List.of();
    }
    return items.stream()
        .map(
            item ->
                item == null
                    ? null
                    : new OrderLine(item.productId(), item.quantity(), item.unitPrice()))
        .collect(Collectors.toList());
  }

  private Map<String, Object> snapshot(PersistedOrder persisted) {
    final OrderRecord order = persisted.order();
    final Map<String, Object> values = new LinkedHashMap<>();
    values.put("customer_id", order.customerId());
    values.put("status", order.status().name());
    values.put("subtotal", order.subtotal());
    values.put("tax_amount", order.taxAmount());
    values.put("total_amount", order.totalAmount());
    values.put("shipping_address", order.shippingAddress());
    values.put(
        "items",
        persisted.items().stream()
            .map(
                item -> {
                  final Map<String, Object> line = new LinkedHashMap<>();
                  line.put("product_id", item.productId());
                  line.put("quantity", item.quantity());
                  line.put("unit_price", item.unitPrice());
                  return line;
                })
            .toList());
    return values;
  }

  private AuditEntryResponse toAuditEntry(AuditRecord record) {
    return new AuditEntryResponse(
        record.auditId(),
        record.tableName(),
        record.action(),
        record.recordId(),
        record.userId(),
        record.occurredAt(),
        readJson(record.oldValuesJson()),
        readJson(record.newValuesJson()));
  }

  private JsonNode readJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse audit snapshot", ex);
    }
  }
}

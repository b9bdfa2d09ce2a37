/*
 * どこで: Commerce API
 * 何を: 注文の作成/参照/ステータス変更/キャンセル/履歴/集計のエンドポイントを提供する
 * なぜ: 注文処理の公開インターフェースを 1 か所にまとめるため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.OrderSearchCriteria;
import com.ecommerce.commerce.model.OrderStatus;
import com.ecommerce.commerce.service.OrderService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/orders")
@RequiredArgsConstructor
@Validated
public class OrderController {

  static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";
  static final String HEADER_USER_ID = "X-User-Id";

  private final OrderService orderService;

  @PostMapping
  public ResponseEntity<OrderCreatedResponse> create(
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
      @RequestHeader(value = HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody CreateOrderRequest request) {
    final OrderCreatedResponse response = orderService.createOrder(request, actor, idempotencyKey);
    return ResponseEntity.created(URI.create("/v1/orders/" + response.orderId())).body(response);
  }

  @GetMapping("/{order_id}")
  public OrderResponse get(
      @PathVariable("order_id") @Positive(message = "order_id must be positive") long orderId) {
    return orderService.getOrder(orderId);
  }

  @GetMapping
  public PagedResponse<OrderSummaryResponse> list(
      @RequestParam(value = "customer_id", required = false) Long customerId,
      @RequestParam(value = "status", required = false) OrderStatus status,
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(value = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(value = "min_amount", required = false) BigDecimal minAmount,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "size", defaultValue = "20") int size) {
    return orderService.listOrders(
        new OrderSearchCriteria(customerId, status, from, to, minAmount, page, size));
  }

  @GetMapping("/customer/{customer_id}/history")
  public CustomerOrderHistoryResponse customerHistory(
      @PathVariable("customer_id") @Positive(message = "customer_id must be positive")
          long customerId,
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(value = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(value = "include_items", defaultValue = "false") boolean includeItems) {
    return orderService.customerHistory(customerId, from, to, includeItems);
  }

  @PatchMapping("/{order_id}/status")
  public OrderResponse updateStatus(
      @PathVariable("order_id") @Positive(message = "order_id must be positive") long orderId,
      @RequestHeader(value = HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody UpdateOrderStatusRequest request) {
    return orderService.updateOrderStatus(orderId, request.status(), actor);
  }

  @PostMapping("/{order_id}/cancel")
  public OrderResponse cancel(
      @PathVariable("order_id") @Positive(message = "order_id must be positive") long orderId,
      @RequestHeader(value = HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody(required = false) CancelOrderRequest request) {
    final String reason = request == null ? null : request.reason();
    return orderService.cancelOrder(orderId, reason, actor);
  }

  @GetMapping("/{order_id}/total")
  public OrderTotalsResponse total(
      @PathVariable("order_id") @Positive(message = "order_id must be positive") long orderId) {
    return orderService.calculateOrderTotal(orderId);
  }

  @GetMapping("/{order_id}/audit")
  public AuditTrailResponse audit(
      @PathVariable("order_id") @Positive(message = "order_id must be positive") long orderId) {
    return orderService.listAudit(orderId);
  }

  @GetMapping("/stats/count")
  public OrderCountResponse countByStatus(@RequestParam("status") OrderStatus status) {
    return orderService.countByStatus(status);
  }

  @GetMapping("/stats/sales")
  public SalesTotalResponse totalSales(
      @RequestParam(value = "from", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(value = "to", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to) {
    return orderService.totalSales(from, to);
  }

  @GetMapping("/stats/sales-trends")
  public SalesTrendResponse salesTrends(
      @RequestParam(value = "days", defaultValue = "30") int days) {
    return orderService.salesTrends(days);
  }
}

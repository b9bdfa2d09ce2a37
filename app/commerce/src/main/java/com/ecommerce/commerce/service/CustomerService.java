/*
 * どこで: Commerce サービス層
 * 何を: 顧客の登録/参照/検索/更新/無効化/再有効化と購入状況の集計を担う
 * なぜ: メールアドレスの一意性を 409 として明示的に返すため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.CatalogConflictException;
import com.ecommerce.commerce.api.CustomerOrderSummaryResponse;
import com.ecommerce.commerce.api.CustomerRequest;
import com.ecommerce.commerce.api.CustomerResponse;
import com.ecommerce.commerce.api.PagedResponse;
import com.ecommerce.commerce.api.ResourceNotFoundException;
import com.ecommerce.commerce.api.TopCustomerResponse;
import com.ecommerce.commerce.config.OrderProperties;
import com.ecommerce.commerce.model.AuditAction;
import com.ecommerce.commerce.model.CustomerOrderStats;
import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.repository.CustomerRepository;
import com.ecommerce.commerce.repository.OrderRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class CustomerService {

  static final String TABLE_CUSTOMERS = "customers";

  static final int MAX_MONTHS = 120;
  static final int MAX_DAYS = 3650;

  private final CustomerRepository customerRepository;
  private final OrderRepository orderRepository;
  private final AuditRecorder auditRecorder;
  private final OrderProperties orderProperties;
  private final Clock clock;

  @Transactional
  public CustomerResponse create(CustomerRequest request, String actor) {
    final String email = normalizeEmail(request.email());
    ensureEmailAvailable(email, null);
    final CustomerRecord created =
        translateDuplicate(
            email,
            () ->
                customerRepository.insert(
                    request.firstName().trim(),
                    request.lastName().trim(),
                    email,
                    blankToNull(request.phone()),
                    Instant.now(clock)));
    final CustomerResponse response = CustomerResponse.from(created);
    auditRecorder.record(
        TABLE_CUSTOMERS, AuditAction.INSERT, created.customerId(), actor, null, response);
    return response;
  }

  @Transactional(readOnly = true)
  public CustomerResponse get(long customerId) {
    return CustomerResponse.from(load(customerId));
  }

  @Transactional(readOnly = true)
  public CustomerResponse getByEmail(String email) {
    return customerRepository
        .findByEmail(normalizeEmail(email))
        .map(CustomerResponse::from)
        .orElseThrow(
            () -> new ResourceNotFoundException("Customer with email " + email + " not found"));
  }

  @Transactional(readOnly = true)
  public PagedResponse<CustomerResponse> search(String term, Boolean active, int page, int size) {
    final int offset = Paging.offset(page, size, orderProperties.maxPageSize());
    return PagedResponse.of(
        customerRepository.search(term, active, offset, size), page, size, CustomerResponse::from);
  }

  @Transactional
  public CustomerResponse update(long customerId, CustomerRequest request, String actor) {
    final CustomerRecord current = load(customerId);
    final String email = normalizeEmail(request.email());
    ensureEmailAvailable(email, customerId);
    final CustomerRecord updated =
        translateDuplicate(
                email,
                () ->
                    customerRepository.update(
                        customerId,
                        request.firstName().trim(),
                        request.lastName().trim(),
                        email,
                        blankToNull(request.phone()),
                        Instant.now(clock)))
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    final CustomerResponse response = CustomerResponse.from(updated);
    auditRecorder.record(
        TABLE_CUSTOMERS,
        AuditAction.UPDATE,
        customerId,
        actor,
        CustomerResponse.from(current),
        response);
    return response;
  }

  @Transactional
  public CustomerResponse deactivate(long customerId, String actor) {
    final CustomerRecord current = load(customerId);
    if (!current.active()) {
      return CustomerResponse.from(current);
    }
    // 既に無効化されていた場合は監査を残さない。
    return customerRepository
        .deactivate(customerId, Instant.now(clock))
        .map(
            updated -> {
              final CustomerResponse response = CustomerResponse.from(updated);
              auditRecorder.record(
                  TABLE_CUSTOMERS,
                  AuditAction.DEACTIVATED,
                  customerId,
                  actor,
                  CustomerResponse.from(current),
                  response);
              return response;
            })
        .orElseGet(() -> CustomerResponse.from(load(customerId)));
  }

  /** 無効化された顧客を有効に戻す。既に有効なら監査を残さず現状を返す。 */
  @Transactional
  public CustomerResponse reactivate(long customerId, String actor) {
    final CustomerRecord current = load(customerId);
    if (current.active()) {
      return CustomerResponse.from(current);
    }
    return customerRepository
        .reactivate(customerId, Instant.now(clock))
        .map(
            updated -> {
              final CustomerResponse response = CustomerResponse.from(updated);
              auditRecorder.record(
                  TABLE_CUSTOMERS,
                  AuditAction.REACTIVATED,
                  customerId,
                  actor,
                  CustomerResponse.from(current),
                  response);
              return response;
            })
        .orElseGet(() -> CustomerResponse.from(load(customerId)));
  }

  /** 直近 months か月の注文 (キャンセル/返金済みを除く) から購入状況とロイヤルティ段階を求める。 */
  @Transactional(readOnly = true)
  public CustomerOrderSummaryResponse orderSummary(long customerId, int months) {
    requireInRange("months", months, MAX_MONTHS);
    final CustomerRecord customer = load(customerId);
    final Instant now = Instant.now(clock);
    final CustomerOrderStats stats =
        orderRepository.customerStats(customerId, monthsBefore(now, months));
    final Long daysSinceLastOrder =
        stats.lastOrderDate() == null
            ? null
            : Duration.between(stats.lastOrderDate(), now).toDays();
    return new CustomerOrderSummaryResponse(
        customer.customerId(),
        customer.fullName(),
        customer.email(),
        months,
        stats.orderCount(),
        stats.totalSpent(),
        stats.averageOrderValue(),
        stats.firstOrderDate(),
        stats.lastOrderDate(),
        daysSinceLastOrder,
        stats.loyaltyLevel());
  }

  @Transactional(readOnly = true)
  public List<TopCustomerResponse> topCustomers(int count, int months) {
    requireInRange("count", count, orderProperties.maxPageSize());
    requireInRange("months", months, MAX_MONTHS);
    final Instant since = monthsBefore(Instant.now(clock), months);
    return customerRepository.findTopSpenders(since, count).stream()
        .map(TopCustomerResponse::from)
        .toList();
  }

  /** 直近 days 日間に注文の無い有効な顧客。 */
  @Transactional(readOnly = true)
  public PagedResponse<CustomerResponse> inactive(int days, int page, int size) {
    requireInRange("days", days, MAX_DAYS);
    final int offset = Paging.offset(page, size, orderProperties.maxPageSize());
    final Instant since = Instant.now(clock).minus(Duration.ofDays(days));
    return PagedResponse.of(
        customerRepository.findWithoutOrdersSince(since, offset, size),
        page,
        size,
        CustomerResponse::from);
  }

  private void requireInRange(String name, int value, int max) {
    if (value < 1 || value > max) {
      throw new IllegalArgumentException(name + " must be between 1 and " + max);
    }
  }

  private Instant monthsBefore(Instant now, int months) {
    return now.atOffset(ZoneOffset.UTC).minusMonths(months).toInstant();
  }

  private CustomerRecord load(long customerId) {
    return customerRepository
        .findById(customerId)
        .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
  }

  private void ensureEmailAvailable(String email, Long ownerId) {
    customerRepository
        .findByEmail(email)
        .filter(existing -> ownerId == null || existing.customerId() != ownerId)
        .ifPresent(
            existing -> {
              throw new CatalogConflictException("Email " + email + " is already registered");
            });
  }

  private <T> T translateDuplicate(String email, Supplier<T> write) {
    try {
      return write.get();
    } catch (DuplicateKeyException ex) {
      throw new CatalogConflictException("Email " + email + " is already registered", ex);
    }
  }

  private String normalizeEmail(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  private String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}

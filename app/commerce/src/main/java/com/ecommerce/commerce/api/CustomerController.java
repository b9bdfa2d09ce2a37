/*
 * どこで: Commerce API
 * 何を: 顧客の CRUD/検索/再有効化と購入状況のエンドポイントを提供する
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.service.CustomerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/customers")
@RequiredArgsConstructor
@Validated
public class CustomerController {

  private final CustomerService customerService;

  @PostMapping
  public ResponseEntity<CustomerResponse> create(
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody CustomerRequest request) {
    final CustomerResponse response = customerService.create(request, actor);
    return ResponseEntity.created(URI.create("/v1/customers/" + response.customerId()))
        .body(response);
  }

  @GetMapping("/{customer_id}")
  public CustomerResponse get(@PathVariable("customer_id") long customerId) {
    return customerService.get(customerId);
  }

  @GetMapping("/by-email")
  public CustomerResponse getByEmail(
      @RequestParam("email") @NotBlank(message = "email is required") String email) {
    return customerService.getByEmail(email);
  }

  @GetMapping("/{customer_id}/order-summary")
  public CustomerOrderSummaryResponse orderSummary(
      @PathVariable("customer_id") long customerId,
      @RequestParam(value = "months", defaultValue = "12") int months) {
    return customerService.orderSummary(customerId, months);
  }

  @GetMapping("/top")
  public List<TopCustomerResponse> topCustomers(
      @RequestParam(value = "count", defaultValue = "10") int count,
      @RequestParam(value = "months", defaultValue = "12") int months) {
    return customerService.topCustomers(count, months);
  }

  @GetMapping("/inactive")
  public PagedResponse<CustomerResponse> inactive(
      @RequestParam(value = "days", defaultValue = "90") int days,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "size", defaultValue = "20") int size) {
    return customerService.inactive(days, page, size);
  }

  @GetMapping
  public PagedResponse<CustomerResponse> search(
      @RequestParam(value = "q", required = false) String term,
      @RequestParam(value = "active", required = false) Boolean active,
      @RequestParam(value = "page", defaultValue = "1") int page,
      @RequestParam(value = "size", defaultValue = "20") int size) {
    return customerService.search(term, active, page, size);
  }

  @PutMapping("/{customer_id}")
  public CustomerResponse update(
      @PathVariable("customer_id") long customerId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor,
      @Valid @RequestBody CustomerRequest request) {
    return customerService.update(customerId, request, actor);
  }

  @DeleteMapping("/{customer_id}")
  public CustomerResponse deactivate(
      @PathVariable("customer_id") long customerId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor) {
    return customerService.deactivate(customerId, actor);
  }

  @PatchMapping("/{customer_id}/reactivate")
  public CustomerResponse reactivate(
      @PathVariable("customer_id") long customerId,
      @RequestHeader(value = OrderController.HEADER_USER_ID, required = false) String actor) {
    return customerService.reactivate(customerId, actor);
  }
}

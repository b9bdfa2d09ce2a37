/*
 * どこで: Commerce データアクセス
 * 何を: 注文検証向けの顧客/商品の読み取りをリポジトリへ委譲する
 */
package com.ecommerce.commerce.repository;

import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.ProductRecord;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcCatalogLookup implements CatalogLookup {

  private final CustomerRepository customerRepository;
  private final ProductRepository productRepository;

  @Override
  public Optional<CustomerRecord> findCustomer(long customerId) {
    return customerRepository.findById(customerId);
  }

  @Override
  public Map<Long, ProductRecord> findProducts(Collection<Long> productIds) {
    return productRepository.findByIds(productIds).stream()
        .collect(Collectors.toMap(ProductRecord::productId, Function.identity()));
  }
}

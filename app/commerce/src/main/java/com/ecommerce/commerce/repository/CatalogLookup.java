/*
 * どこで: Commerce データアクセス
 * 何を: 注文検証が参照する顧客/商品の読み取り口
 * なぜ: 検証ロジックを DB なしでテストできるようにするため
 */
package com.ecommerce.commerce.repository;

import com.ecommerce.commerce.model.CustomerRecord;
import com.ecommerce.commerce.model.ProductRecord;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public interface CatalogLookup {

  Optional<CustomerRecord> findCustomer(long customerId);

  /** 指定 ID のうち存在する商品だけを ID で引けるように返す。 */
  Map<Long, ProductRecord> findProducts(Collection<Long> productIds);
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: 商品ごとの販売実績を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

/** 商品ごとの期間内の受注件数/販売数量/売上。 */
public record ProductSales(
    long productId,
    String name,
    long categoryId,
    long orderCount,
    long unitsSold,
    BigDecimal revenue) {}

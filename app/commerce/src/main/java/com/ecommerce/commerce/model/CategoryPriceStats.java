/*
 * どこで: Commerce ドメインモデル
 * 何を: カテゴリ内の商品数と価格の平均/最小/最大を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

/** カテゴリ内の有効な商品の件数と価格。商品が無ければ価格は null。 */
public record CategoryPriceStats(
    long productCount, BigDecimal averagePrice, BigDecimal minPrice, BigDecimal maxPrice) {}

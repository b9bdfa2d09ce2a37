/*
 * どこで: Commerce ドメインモデル
 * 何を: 一括価格改定で変わった商品 1 件の旧価格と新価格を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;

public record PriceChange(long productId, BigDecimal oldPrice, BigDecimal newPrice) {}

/*
 * どこで: Commerce サービス層
 * 何を: 明細から小計/税額/合計を計算する
 * なぜ: 端数処理を 1 か所に固定し、作成時と再計算時で同じ結果にするため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.config.OrderProperties;
import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderTotals;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class OrderTotalCalculator {

  static final int MONEY_SCALE = 2;

  private final OrderProperties orderProperties;

  public OrderTotals calculate(List<OrderLine> lines) {
    return fromSubtotal(
        lines.stream().map(OrderLine::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add));
  }

  public OrderTotals calculateForItems(List<OrderItemRecord> items) {
    return fromSubtotal(
        items.stream().map(OrderItemRecord::lineTotal).reduce(BigDecimal.ZERO, BigDecimal::add));
  }

  @VisibleForTesting
  OrderTotals fromSubtotal(BigDecimal rawSubtotal) {
    final BigDecimal subtotal = rawSubtotal.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    // 税額は小計に税率を掛けた後に 1 回だけ丸める。
    final BigDecimal taxAmount =
        subtotal.multiply(orderProperties.taxRate()).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    return new OrderTotals(subtotal, taxAmount, subtotal.add(taxAmount));
  }
}

/*
 * どこで: Commerce サービス層
 * 何を: 注文コマンド/ステータス遷移/売上額のメトリクス記録を集約する
 * なぜ: 注文処理の成功率と遷移の偏りを運用で継続監視できるようにするため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.model.OrderStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class OrderMetrics {

  static final String METRIC_COMMAND_TOTAL = "commerce.order.command.total";
  static final String METRIC_TRANSITION_TOTAL = "commerce.order.transition.total";
  static final String METRIC_ORDER_AMOUNT = "commerce.order.amount";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final DistributionSummary orderAmountSummary;

  public OrderMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.orderAmountSummary =
        DistributionSummary.builder(METRIC_ORDER_AMOUNT)
            .description("Total amount of created orders")
            .baseUnit("currency")
            .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    commandCounters
        .computeIfAbsent(
            action + ":" + result,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Order command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordTransition(OrderStatus from, OrderStatus to) {
    transitionCounters
        .computeIfAbsent(
            from.name() + ":" + to.name(),
            ignored ->
                Counter.builder(METRIC_TRANSITION_TOTAL)
                    .description("Accepted order status transitions")
                    .tags(Tags.of("from", from.name(), "to", to.name()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordOrderAmount(BigDecimal totalAmount) {
    if (totalAmount == null || totalAmount.signum() <= 0) {
      return;
    }
    orderAmountSummary.record(totalAmount.doubleValue());
  }
}

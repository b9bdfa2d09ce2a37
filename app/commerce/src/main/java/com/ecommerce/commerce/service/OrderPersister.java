/*
 * どこで: Commerce サービス層
 * 何を: 注文ヘッダと全明細を 1 トランザクションで書き込む
 * なぜ: 途中の明細で失敗しても注文が半端に残らないようにするため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.OrderPersistenceException;
import com.ecommerce.commerce.model.OrderItemRecord;
import com.ecommerce.commerce.model.OrderLine;
import com.ecommerce.commerce.model.OrderRecord;
import com.ecommerce.commerce.model.OrderTotals;
import com.ecommerce.commerce.model.PersistedOrder;
import com.ecommerce.commerce.repository.OrderItemRepository;
import com.ecommerce.commerce.repository.OrderRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class OrderPersister {

  private static final Logger logger = LoggerFactory.getLogger(OrderPersister.class);

  static final String STEP_INSERT_ORDER = "insert_order";
  static final String STEP_INSERT_ITEM = "insert_item";

  private final OrderRepository orderRepository;
  private final OrderItemRepository orderItemRepository;

  @Transactional
  public PersistedOrder persist(
      long customerId,
      String shippingAddress,
      List<OrderLine> lines,
      OrderTotals totals,
      Instant orderDate) {
    final OrderRecord order;
    try {
      order = orderRepository.insert(customerId, totals, shippingAddress, orderDate);
    } catch (DataAccessException | TransactionException ex) {
      logger.warn(
          "order persistence failed step={} customerId={} total={}",
          STEP_INSERT_ORDER,
          customerId,
          totals.totalAmount(),
          ex);
      throw new OrderPersistenceException(STEP_INSERT_ORDER, ex);
    }

    final List<OrderItemRecord> items = new ArrayList<>(lines.size());
    for (int index = 0; index < lines.size(); index++) {
      final OrderLine line = lines.get(index);
      try {
        items.add(orderItemRepository.insert(order.orderId(), line, orderDate));
      } catch (DataAccessException | TransactionException ex) {
        // 例外を外へ伝播させ、ヘッダと書き込み済みの明細をまとめてロールバックさせる。
        final String step = STEP_INSERT_ITEM + "[" + index + "]";
        logger.warn(
            "order persistence failed step={} customerId={} productId={}",
            step,
            customerId,
            line.productId(),
            ex);
        throw new OrderPersistenceException(step, ex);
      }
    }
    return new PersistedOrder(order, items);
  }
}

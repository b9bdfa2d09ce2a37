/*
 * どこで: Commerce サービス補助
 * 何を: 注文作成リクエストの正規化 JSON から SHA-256 を生成する
 * なぜ: 同じ Idempotency-Key で異なる注文内容が送られたことを検出するため
 */
package com.ecommerce.commerce.service;

import com.ecommerce.commerce.api.CreateOrderRequest;
import com.ecommerce.commerce.api.OrderItemRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RequestHasher {

  private final ObjectMapper objectMapper;

  public String hash(CreateOrderRequest request) {
    // キー順を固定し、金額は scale 差 (29.9 と 29.90) を吸収して同じ JSON にする。
    final Map<String, Object> canonical = new LinkedHashMap<>();
    canonical.put("customer_id", request.customerId());
    canonical.put("shipping_address", request.shippingAddress());
    final List<Map<String, Object>> items = new ArrayList<>();
    if (request.items() != null) {
      for (OrderItemRequest item : request.items()) {
        final Map<String, Object> line = new LinkedHashMap<>();
        line.put("product_id", item == null ? null : item.productId());
        line.put("quantity", item == null ? null : item.quantity());
        line.put("unit_price", item == null ? null : normalize(item.unitPrice()));
        items.add(line);
      }
    }
    canonical.put("items", items);
    try {
      final byte[] json = objectMapper.writeValueAsBytes(canonical);
      return toHex(MessageDigest.getInstance("SHA-256").digest(json));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize request for idempotency", ex);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String normalize(BigDecimal value) {
    return value == null ? null : value.stripTrailingZeros().toPlainString();
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}

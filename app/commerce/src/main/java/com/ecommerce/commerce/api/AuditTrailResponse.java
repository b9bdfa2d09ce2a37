/*
 * どこで: Commerce API
 * 何を: 注文 1 件の監査履歴の応答を表す
 */
package com.ecommerce.commerce.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditTrailResponse(long orderId, List<AuditEntryResponse> entries) {

  public AuditTrailResponse {
    entries = entries == null ? List.of() : List.copyOf(entries);
  }
}

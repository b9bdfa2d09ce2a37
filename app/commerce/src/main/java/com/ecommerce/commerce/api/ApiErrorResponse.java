/*
 * どこで: Commerce API
 * 何を: エラーレスポンスの共通フォーマットを定義する
 * なぜ: 注文検証の違反をまとめて返せるようにするため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.ValidationViolation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(
    ApiErrorCode code, String message, List<ValidationViolation> violations) {

  public ApiErrorResponse {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, List.of());
  }
}

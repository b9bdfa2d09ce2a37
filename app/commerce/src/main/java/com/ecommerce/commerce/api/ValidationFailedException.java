/*
 * どこで: Commerce API
 * 何を: 注文/カタログ入力の検証失敗(400)を表す例外を定義する
 * なぜ: 1 件目で止めず全違反をまとめて返すため
 */
package com.ecommerce.commerce.api;

import com.ecommerce.commerce.model.ValidationViolation;
import java.util.List;

public class ValidationFailedException extends RuntimeException {

  private final List<ValidationViolation> violations;

  public ValidationFailedException(List<ValidationViolation> violations) {
    super(summarize(violations));
    this.violations = List.copyOf(violations);
  }

  public List<ValidationViolation> getViolations() {
    return violations;
  }

  private static String summarize(List<ValidationViolation> violations) {
    if (violations.size() == 1) {
      return violations.get(0).message();
    }
    return violations.size() + " validation errors";
  }
}

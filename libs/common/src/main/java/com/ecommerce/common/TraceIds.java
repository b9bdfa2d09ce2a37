package com.ecommerce.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** 呼び出し元が渡した ID を優先し、空なら新規に採番する。 */
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}

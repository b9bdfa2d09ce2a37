/*
 * どこで: Commerce ドメインモデル
 * 何を: 監査ログの操作種別を定義する
 * なぜ: audit_log.action の CHECK 制約と値を一致させるため
 */
package com.ecommerce.commerce.model;

public enum AuditAction {
  INSERT,
  UPDATE,
  DELETE,
  CANCELLED,
  DEACTIVATED,
  REACTIVATED
}

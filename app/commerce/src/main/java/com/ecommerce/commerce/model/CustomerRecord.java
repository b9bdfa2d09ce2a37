/*
 * どこで: Commerce ドメインモデル
 * 何を: customers テーブルのスナップショットを表す
 * なぜ: 注文検証とカタログ API で共通化するため
 */
package com.ecommerce.commerce.model;

import java.time.Instant;

public record CustomerRecord(
    long customerId,
    String firstName,
    String lastName,
    String email,
    String phone,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {

  public String fullName() {
    return firstName + " " + lastName;
  }
}

/*
 * どこで: Commerce ドメインモデル
 * 何を: categories テーブルのスナップショットを表す
 */
package com.ecommerce.commerce.model;

import java.time.Instant;

public record CategoryRecord(
    long categoryId,
    String name,
    Long parentCategoryId,
    int displayOrder,
    boolean active,
    Instant createdAt,
    Instant modifiedAt) {}

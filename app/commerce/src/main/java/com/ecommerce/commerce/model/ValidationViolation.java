/*
 * どこで: Commerce ドメインモデル
 * 何を: 入力検証の違反 1 件を表す
 */
package com.ecommerce.commerce.model;

/**
 * 注文入力の違反 1 件。field は {@code items[1].quantity} のようなパス、
 * reference は違反した顧客/商品 ID (無い場合は null)。
 */
public record ValidationViolation(String field, Long reference, String message) {}

/*
 * どこで: Commerce ドメインモデル
 * 何を: UTC 日付 1 日分の注文件数/売上/平均注文額を表す
 */
package com.ecommerce.commerce.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/** UTC 日付ごとの配送完了注文の件数と売上。 */
public record DailySales(
    LocalDate day, long orderCount, BigDecimal totalSales, BigDecimal averageOrderValue) {}

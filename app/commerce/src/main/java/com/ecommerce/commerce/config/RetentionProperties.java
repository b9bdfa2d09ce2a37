/*
 * どこで: Commerce アプリの設定バインド
 * 何を: 期限切れ冪等キー削除のスケジュール設定を保持する
 */
package com.ecommerce.commerce.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "commerce.retention")
public record RetentionProperties(boolean enabled, Duration cleanupInterval) {}

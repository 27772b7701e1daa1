/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: 完了済み冪等レコードの retention 設定を保持する
 * なぜ: 削除間隔と保持期間、有効/無効を運用で調整できるようにするため
 */
package com.example.newsletter.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "newsletter.retention")
public record NewsletterRetentionProperties(
    boolean enabled, Duration cleanupInterval, Duration completedTtl) {}

/*
 * どこで: Social Notify アプリの設定バインド
 * 何を: ファンアウト時の重複抑止窓/通知 TTL/ディープリンク基底 URL/コメント抜粋長を保持する
 * なぜ: 文面と重複抑止のパラメータを環境ごとに調整できるようにするため
 */
package com.example.socialnotify.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social-notify.fanout")
public record FanoutProperties(
    Duration dedupWindow,
    Duration notificationTtl,
    String frontendBaseUrl,
    int commentExcerptLength) {}

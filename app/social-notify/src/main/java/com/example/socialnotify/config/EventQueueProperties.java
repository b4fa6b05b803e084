/*
 * どこで: Social Notify アプリの設定バインド
 * 何を: インプロセスのイベントキュー容量とドレインスレッドの待機時間を保持する
 * なぜ: 受付バーストの吸収量と停止時の猶予を運用で調整できるようにするため
 */
package com.example.socialnotify.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social-notify.queue")
public record EventQueueProperties(int capacity, Duration pollTimeout, Duration shutdownTimeout) {}

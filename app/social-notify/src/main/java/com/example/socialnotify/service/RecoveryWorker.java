/*
 * どこで: Social Notify リカバリワーカー
 * 何を: 起動完了時と一定間隔でリカバリスイープを起動する
 * なぜ: 未処理イベントを手動介入なしで最終的にファンアウトさせるため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.RecoveryProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "social-notify.recovery.enabled", havingValue = "true")
public class RecoveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(RecoveryWorker.class);

  private final RecoverySweepService recoverySweepService;
  private final RecoveryProperties properties;

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!properties.runOnStartup()) {
      return;
    }
    try {
      recoverySweepService.sweep();
    } catch (DataAccessException ex) {
      // 起動時スイープの失敗でアプリを落とさず、定期実行に任せる
      logger.warn("startup recovery sweep failed", ex);
    }
  }

  @Scheduled(
      fixedDelayString = "${social-notify.recovery.interval}",
      initialDelayString = "${social-notify.recovery.interval}")
  public void run() {
    recoverySweepService.sweep();
  }
}

/*
 * どこで: Common 共通設定
 * 何を: Clock と IdGenerator を DI 可能にする
 * なぜ: 時刻と ID 採番をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.IdGenerator;
import org.springframework.util.JdkIdGenerator;

@Configuration
public class PlatformConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public IdGenerator idGenerator() {
    return new JdkIdGenerator();
  }
}

/*
 * どこで: Common 共通設定
 * 何を: Clock と RetryExecutor を DI 可能にする
 * なぜ: サーバ/クライアントで同一の時刻注入を使うため
 */
package com.example.enterprise.common.config;

import com.example.enterprise.common.retry.RetryExecutor;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public RetryExecutor retryExecutor(Clock clock) {
    return new RetryExecutor(clock);
  }
}

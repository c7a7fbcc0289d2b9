/*
 * どこで: Enterprise クライアント設定
 * 何を: 状態収束待ちのバックオフ設定を保持する
 * なぜ: ポーリング間隔と打ち切り条件を運用で調整できるようにするため
 */
package com.example.enterprise.client.config;

import com.example.enterprise.common.retry.BackoffPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Unset fields fall back to {@link BackoffPolicy#defaults()}. {@code max-elapsed-time: 0s} and
 * {@code max-attempts: 0} mean unlimited.
 */
@ConfigurationProperties(prefix = "enterprise.client.retry")
public record EnterpriseRetryProperties(
    Duration initialInterval,
    Double multiplier,
    Duration maxInterval,
    Duration maxElapsedTime,
    Integer maxAttempts,
    Double randomizationFactor) {

  public BackoffPolicy toPolicy() {
    final BackoffPolicy defaults = BackoffPolicy.defaults();
    return new BackoffPolicy(
        initialInterval != null ? initialInterval : defaults.initialInterval(),
        multiplier != null ? multiplier : defaults.multiplier(),
        maxInterval != null ? maxInterval : defaults.maxInterval(),
        resolveMaxElapsedTime(defaults),
        maxAttempts != null ? maxAttempts : defaults.maxAttempts(),
        randomizationFactor != null ? randomizationFactor : defaults.randomizationFactor());
  }

  private Duration resolveMaxElapsedTime(BackoffPolicy defaults) {
    if (maxElapsedTime == null) {
      return defaults.maxElapsedTime();
    }
    return maxElapsedTime.isZero() ? null : maxElapsedTime;
  }
}

package com.example.enterprise.common.retry;

import java.time.Duration;

/** Notified after each failed attempt that will be retried. */
@FunctionalInterface
public interface RetryListener {

  void onRetry(int attempt, Exception error, Duration nextDelay);

  static RetryListener noop() {
    return (attempt, error, nextDelay) -> {};
  }
}

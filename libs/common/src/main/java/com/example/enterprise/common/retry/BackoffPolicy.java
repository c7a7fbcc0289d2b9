/*
 * どこで: common のリトライ基盤
 * 何を: 再試行間隔と打ち切り条件を値として保持する
 * なぜ: 呼び出し側ごとのループ実装をやめ、間隔計算を単体で検証できるようにするため
 */
package com.example.enterprise.common.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with optional jitter.
 *
 * <pre>
 * delay(n) = min(initialInterval * multiplier^(n-1), maxInterval)
 * jittered = delay(n) * (1 - randomizationFactor + 2 * randomizationFactor * random)
 * </pre>
 *
 * <p>The cap is applied before jitter, so a jittered delay may exceed {@code maxInterval} by at
 * most {@code randomizationFactor}.
 *
 * @param initialInterval delay after the first failed attempt, at least 1ms
 * @param multiplier growth factor per attempt, at least 1.0
 * @param maxInterval upper bound of the un-jittered delay
 * @param maxElapsedTime total time budget, {@code null} for unlimited
 * @param maxAttempts attempt limit including the first call, {@code 0} for unlimited
 * @param randomizationFactor jitter ratio in {@code [0.0, 1.0)}
 */
public record BackoffPolicy(
    Duration initialInterval,
    double multiplier,
    Duration maxInterval,
    Duration maxElapsedTime,
    int maxAttempts,
    double randomizationFactor) {

  public static final int UNLIMITED_ATTEMPTS = 0;

  public BackoffPolicy {
    Objects.requireNonNull(initialInterval, "initialInterval is required");
    Objects.requireNonNull(maxInterval, "maxInterval is required");
    // 再試行の間には必ず 1ms 以上待つ
    if (initialInterval.toMillis() <= 0) {
      throw new IllegalArgumentException(
          "initialInterval must be at least 1ms (current: " + initialInterval + ")");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
    }
    if (maxInterval.compareTo(initialInterval) < 0) {
      throw new IllegalArgumentException(
          "maxInterval must be >= initialInterval (initial: "
              + initialInterval
              + ", max: "
              + maxInterval
              + ")");
    }
    if (maxElapsedTime != null && (maxElapsedTime.isNegative() || maxElapsedTime.isZero())) {
      throw new IllegalArgumentException(
          "maxElapsedTime must be positive (current: " + maxElapsedTime + ")");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException(
          "maxAttempts must not be negative (current: " + maxAttempts + ")");
    }
    if (randomizationFactor < 0.0d || randomizationFactor >= 1.0d) {
      throw new IllegalArgumentException(
          "randomizationFactor must be in [0.0, 1.0) (current: " + randomizationFactor + ")");
    }
  }

  /** General purpose policy: 500ms start, x1.5, 60s cap, 15 minutes budget, +-50% jitter. */
  public static BackoffPolicy defaults() {
    return new BackoffPolicy(
        Duration.ofMillis(500),
        1.5d,
        Duration.ofSeconds(60),
        Duration.ofMinutes(15),
        UNLIMITED_ATTEMPTS,
        0.5d);
  }

  /** Tight bounds for tests: 100ms start, 5s cap, 60s budget. */
  public static BackoffPolicy testing() {
    return new BackoffPolicy(
        Duration.ofMillis(100),
        1.5d,
        Duration.ofSeconds(5),
        Duration.ofSeconds(60),
        UNLIMITED_ATTEMPTS,
        0.1d);
  }

  /** Fixed delay between attempts and no elapsed-time limit. */
  public static BackoffPolicy constant(Duration interval) {
    return new BackoffPolicy(interval, 1.0d, interval, null, UNLIMITED_ATTEMPTS, 0.0d);
  }

  public BackoffPolicy withMaxAttempts(int attempts) {
    return new BackoffPolicy(
        initialInterval, multiplier, maxInterval, maxElapsedTime, attempts, randomizationFactor);
  }

  public BackoffPolicy withMaxElapsedTime(Duration elapsed) {
    return new BackoffPolicy(
        initialInterval, multiplier, maxInterval, elapsed, maxAttempts, randomizationFactor);
  }

  public BackoffPolicy withoutJitter() {
    return new BackoffPolicy(
        initialInterval, multiplier, maxInterval, maxElapsedTime, maxAttempts, 0.0d);
  }

  /**
   * Delay to wait after the given failed attempt.
   *
   * @param attempt number of the attempt that just failed, starting at 1
   * @param random a value in {@code [0.0, 1.0)}; {@code 0.5} yields the un-jittered delay
   */
  public Duration delayFor(int attempt, double random) {
    if (attempt <= 0) {
      throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
    }
    final double baseMillis = initialInterval.toMillis() * Math.pow(multiplier, attempt - 1);
    final double capped = Math.min(baseMillis, maxInterval.toMillis());
    final double delta = capped * randomizationFactor;
    final double jittered = capped - delta + (random * 2.0d * delta);
    return Duration.ofMillis(Math.max(1L, Math.round(jittered)));
  }

  /**
   * Whether another attempt is allowed.
   *
   * @param attempts attempts made so far
   * @param elapsed time since the first attempt started
   * @param nextDelay wait that would precede the next attempt
   */
  public boolean isExhausted(int attempts, Duration elapsed, Duration nextDelay) {
    if (maxAttempts != UNLIMITED_ATTEMPTS && attempts >= maxAttempts) {
      return true;
    }
    // 次の待機で予算を超えるなら待たずに打ち切る
    return maxElapsedTime != null && elapsed.plus(nextDelay).compareTo(maxElapsedTime) > 0;
  }
}

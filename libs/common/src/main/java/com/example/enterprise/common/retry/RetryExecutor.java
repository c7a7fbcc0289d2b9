/*
 * どこで: common のリトライ基盤
 * 何を: BackoffPolicy に従って操作を成功/打ち切り/キャンセルまで再実行する
 * なぜ: 結果整合な読み取りの待ち合わせを業務ロジックから切り離すため
 */
package com.example.enterprise.common.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless retry executor. The calling thread runs every attempt and performs the timed wait
 * between them, so independent invocations share nothing.
 *
 * <p>Outcomes:
 *
 * <ul>
 *   <li>the operation's result on success
 *   <li>{@link RetryExhaustedException} once the policy's attempt or elapsed-time limit is hit
 *   <li>{@link RetryCancelledException} when the signal fires or the thread is interrupted
 *   <li>the operation's own exception when the retry predicate rejects it (checked exceptions
 *       are wrapped in {@link RetryAbortedException})
 * </ul>
 */
public class RetryExecutor {

  private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

  private final Clock clock;
  private final DoubleSupplier jitterSource;
  private final Sleeper sleeper;

  public RetryExecutor(Clock clock) {
    this(clock, () -> ThreadLocalRandom.current().nextDouble(), Sleeper.onSignal());
  }

  public RetryExecutor(Clock clock, DoubleSupplier jitterSource, Sleeper sleeper) {
    this.clock = clock;
    this.jitterSource = jitterSource;
    this.sleeper = sleeper;
  }

  public <T> T retry(RetryableOperation<T> operation, BackoffPolicy policy) {
    return retry(operation, policy, CancellationSignal.create());
  }

  public <T> T retry(
      RetryableOperation<T> operation, BackoffPolicy policy, CancellationSignal signal) {
    return retry(operation, policy, signal, error -> true, RetryListener.noop());
  }

  public <T> T retry(
      RetryableOperation<T> operation,
      BackoffPolicy policy,
      CancellationSignal signal,
      Predicate<Exception> retryOn,
      RetryListener listener) {
    final Instant startedAt = clock.instant();
    int attempt = 0;
    Exception lastError = null;
    while (true) {
      if (signal.isCancelled(clock)) {
        logger.debug("retry cancelled before attempt={}", attempt + 1);
        throw new RetryCancelledException(attempt, lastError);
      }
      attempt++;
      try {
        return operation.execute();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new RetryCancelledException(attempt, ex);
      } catch (Exception ex) {
        lastError = ex;
        if (!retryOn.test(ex)) {
          throw nonRetryable(attempt, ex);
        }
        final Duration elapsed = Duration.between(startedAt, clock.instant());
        final Duration delay = policy.delayFor(attempt, jitterSource.getAsDouble());
        if (policy.isExhausted(attempt, elapsed, delay)) {
          logger.warn("retry exhausted attempts={} elapsed={}", attempt, elapsed, ex);
          throw new RetryExhaustedException(attempt, elapsed, ex);
        }
        listener.onRetry(attempt, ex, delay);
        logger.debug("retry scheduled attempt={} delay={} error={}", attempt, delay, ex.toString());
        waitBeforeNextAttempt(delay, signal, attempt, ex);
      }
    }
  }

  private void waitBeforeNextAttempt(
      Duration delay, CancellationSignal signal, int attempt, Exception lastError) {
    Duration wait = delay;
    boolean untilDeadline = false;
    if (signal.deadline().isPresent()) {
      // 期限を越えて眠らないよう、残り時間で待機を切り詰める
      final Duration remaining = Duration.between(clock.instant(), signal.deadline().get());
      if (remaining.compareTo(wait) < 0) {
        wait = remaining.isNegative() ? Duration.ZERO : remaining;
        untilDeadline = true;
      }
    }
    try {
      sleeper.sleep(wait, signal);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      final RetryCancelledException cancelled = new RetryCancelledException(attempt, lastError);
      cancelled.addSuppressed(ex);
      throw cancelled;
    }
    // 期限までの待機を終えたら、時計の粒度で数 ms 早く起きても次の試行はしない
    if (untilDeadline) {
      logger.debug("retry deadline reached attempt={}", attempt);
      throw new RetryCancelledException(attempt, lastError);
    }
  }

  private RuntimeException nonRetryable(int attempt, Exception ex) {
    if (ex instanceof RuntimeException runtime) {
      return runtime;
    }
    return new RetryAbortedException(attempt, ex);
  }
}

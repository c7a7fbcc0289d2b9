/*
 * どこで: common のリトライ基盤
 * 何を: 呼び出し側が所有するキャンセル/期限を表す
 * なぜ: 待機中のリトライを外部から止められるようにするため
 */
package com.example.enterprise.common.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class CancellationSignal {

  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final Instant deadline;

  private CancellationSignal(Instant deadline) {
    this.deadline = deadline;
  }

  /** A signal that only fires when {@link #cancel()} is called. */
  public static CancellationSignal create() {
    return new CancellationSignal(null);
  }

  public static CancellationSignal withDeadline(Instant deadline) {
    if (deadline == null) {
      throw new IllegalArgumentException("deadline is required");
    }
    return new CancellationSignal(deadline);
  }

  public void cancel() {
    cancelled.countDown();
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  public boolean isCancelled(Clock clock) {
    if (cancelled.getCount() == 0) {
      return true;
    }
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /**
   * Blocks for up to {@code timeout}, returning early once {@link #cancel()} is called.
   *
   * @return {@code true} if the signal was cancelled while waiting
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isNegative() || timeout.isZero()) {
      return cancelled.getCount() == 0;
    }
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}

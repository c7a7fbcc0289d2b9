package com.example.enterprise.common.retry;

import java.time.Duration;

/** Timed wait between retry attempts. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration, CancellationSignal signal) throws InterruptedException;

  /** Waits on the signal so that {@link CancellationSignal#cancel()} wakes the caller. */
  static Sleeper onSignal() {
    return (duration, signal) -> signal.await(duration);
  }
}

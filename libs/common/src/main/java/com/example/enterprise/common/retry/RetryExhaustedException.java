package com.example.enterprise.common.retry;

import java.time.Duration;

public class RetryExhaustedException extends RetryException {

  private final Duration elapsed;

  public RetryExhaustedException(int attempts, Duration elapsed, Throwable lastError) {
    super(
        "retry exhausted after " + attempts + " attempts in " + elapsed + ": " + describe(lastError),
        attempts,
        lastError);
    this.elapsed = elapsed;
  }

  public Duration elapsed() {
    return elapsed;
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "no error recorded";
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }
}

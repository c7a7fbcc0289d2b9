package com.example.enterprise.common.retry;

/** Wraps a checked, non-retryable error raised by the operation. */
public class RetryAbortedException extends RetryException {

  public RetryAbortedException(int attempts, Exception cause) {
    super("retry aborted by non-retryable error: " + cause.getMessage(), attempts, cause);
  }
}

package com.example.enterprise.common.retry;

public class RetryCancelledException extends RetryException {

  public RetryCancelledException(int attempts, Throwable lastError) {
    super("retry cancelled after " + attempts + " attempts", attempts, lastError);
  }
}

package com.example.enterprise.common.retry;

@FunctionalInterface
public interface RetryableOperation<T> {

  T execute() throws Exception;
}

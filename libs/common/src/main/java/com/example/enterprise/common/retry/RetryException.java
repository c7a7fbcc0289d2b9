/*
 * どこで: common のリトライ基盤
 * 何を: リトライ終了理由を表す例外の基底クラス
 * なぜ: 打ち切り/キャンセル/中断を呼び出し側で型で区別するため
 */
package com.example.enterprise.common.retry;

public abstract class RetryException extends RuntimeException {

  private final int attempts;

  protected RetryException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  /** The error of the last attempt, or {@code null} when none was made. */
  public Throwable lastError() {
    return getCause();
  }
}

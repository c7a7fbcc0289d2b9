/*
 * どこで: Enterprise クライアント
 * 何を: enterprise サービス呼び出し失敗を表現する
 * なぜ: 呼び出し側がリトライ可否を理由で判断できるようにするため
 */
package com.example.enterprise.client;

public class EnterpriseIntegrationException extends RuntimeException {

  public enum Reason {
    INVALID_CODE,
    BAD_REQUEST,
    STATE_INCONSISTENT,
    UNAVAILABLE,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public EnterpriseIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public EnterpriseIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** Only transport-level failures are worth retrying. */
  public boolean isRetryable() {
    return reason == Reason.UNAVAILABLE || reason == Reason.TIMEOUT;
  }
}

/*
 * どこで: Enterprise クライアント
 * 何を: GetState をバックオフ付きでポーリングし、期待状態への収束を待つ
 * なぜ: 書き込み直後の読み取り遅延を呼び出し側で吸収するため
 */
package com.example.enterprise.client;

import com.example.enterprise.client.dto.EnterpriseStateResponse;
import com.example.enterprise.common.retry.BackoffPolicy;
import com.example.enterprise.common.retry.CancellationSignal;
import com.example.enterprise.common.retry.RetryExecutor;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class EnterpriseStateAwaiter {

  private static final Logger logger = LoggerFactory.getLogger(EnterpriseStateAwaiter.class);

  private final EnterpriseClient enterpriseClient;
  private final RetryExecutor retryExecutor;
  private final BackoffPolicy defaultPolicy;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "クライアントと RetryExecutor は Spring 管理の共有コンポーネントのため")
  public EnterpriseStateAwaiter(
      EnterpriseClient enterpriseClient, RetryExecutor retryExecutor, BackoffPolicy defaultPolicy) {
    this.enterpriseClient = enterpriseClient;
    this.retryExecutor = retryExecutor;
    this.defaultPolicy = defaultPolicy;
  }

  public EnterpriseStateResponse awaitState(EnterpriseStateExpectation expectation) {
    return awaitState(expectation, defaultPolicy, CancellationSignal.create());
  }

  public EnterpriseStateResponse awaitState(
      EnterpriseStateExpectation expectation, BackoffPolicy policy) {
    return awaitState(expectation, policy, CancellationSignal.create());
  }

  public EnterpriseStateResponse awaitState(
      EnterpriseStateExpectation expectation, BackoffPolicy policy, CancellationSignal signal) {
    return retryExecutor.retry(
        () -> {
          final EnterpriseStateResponse response = enterpriseClient.getState();
          final var mismatch = expectation.mismatch(response);
          if (mismatch.isPresent()) {
            throw new StateNotConvergedException(mismatch.get(), response);
          }
          return response;
        },
        policy,
        signal,
        EnterpriseStateAwaiter::isRetryable,
        (attempt, error, nextDelay) ->
            logger.debug(
                "enterprise state not converged attempt={} next_delay={} reason={}",
                attempt,
                nextDelay,
                error.getMessage()));
  }

  static boolean isRetryable(Exception error) {
    if (error instanceof StateNotConvergedException) {
      return true;
    }
    // 入力不正や不変条件違反は待っても回復しないため即時に返す
    return error instanceof EnterpriseIntegrationException integration && integration.isRetryable();
  }
}

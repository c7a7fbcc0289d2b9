/*
 * どこで: Enterprise クライアント
 * 何を: enterprise サービスの Activate/Deactivate/GetState 呼び出しを担当する
 * なぜ: 一度構築した接続ハンドルを呼び出し側へ注入して使い回すため
 */
package com.example.enterprise.client;

import com.example.enterprise.client.dto.ActivateRequest;
import com.example.enterprise.client.dto.ApiErrorResponse;
import com.example.enterprise.client.dto.EnterpriseStateResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class EnterpriseClient {

  private static final Logger logger = LoggerFactory.getLogger(EnterpriseClient.class);

  private static final String ACTIVATE_PATH = "/v1/enterprise/activate";
  private static final String DEACTIVATE_PATH = "/v1/enterprise/deactivate";
  private static final String STATE_PATH = "/v1/enterprise/state";
  private static final String CODE_INVALID_ACTIVATION_CODE = "INVALID_ACTIVATION_CODE";
  private static final String CODE_STATE_INCONSISTENT = "STATE_INCONSISTENT";

  private final RestClient enterpriseRestClient;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public EnterpriseClient(RestClient enterpriseRestClient, ObjectMapper objectMapper) {
    this.enterpriseRestClient = enterpriseRestClient;
    this.objectMapper = objectMapper;
  }

  public void activate(String activationCode, Instant expires) {
    // 空のコードもサーバの検証に委ね、INVALID_CODE として受け取る
    execute(
        "activate",
        () ->
            enterpriseRestClient
                .post()
                .uri(ACTIVATE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ActivateRequest(activationCode, expires))
                .retrieve()
                .toBodilessEntity());
  }

  public void deactivate() {
    execute(
        "deactivate",
        () -> enterpriseRestClient.post().uri(DEACTIVATE_PATH).retrieve().toBodilessEntity());
  }

  public EnterpriseStateResponse getState() {
    return requireResponse(
        execute(
            "getState",
            () ->
                enterpriseRestClient
                    .get()
                    .uri(STATE_PATH)
                    .retrieve()
                    .body(EnterpriseStateResponse.class)));
  }

  private <T> T execute(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (RuntimeException ex) {
      logger.warn("enterprise {} response handling failed", operation, ex);
      throw new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.INVALID_RESPONSE,
          "enterprise response parse failed",
          ex);
    }
  }

  private EnterpriseStateResponse requireResponse(EnterpriseStateResponse response) {
    if (response == null || response.state() == null) {
      throw new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.INVALID_RESPONSE,
          "enterprise state response is invalid");
    }
    return response;
  }

  private EnterpriseIntegrationException mapResponseException(
      String operation, RestClientResponseException ex) {
    logger.warn(
        "enterprise {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final ApiErrorResponse error = readError(ex);
    final String message = error != null && error.message() != null ? error.message() : null;
    if (error != null && CODE_INVALID_ACTIVATION_CODE.equals(error.code())) {
      return new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.INVALID_CODE,
          message != null ? message : "activation code is invalid",
          ex);
    }
    if (error != null && CODE_STATE_INCONSISTENT.equals(error.code())) {
      return new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.STATE_INCONSISTENT,
          message != null ? message : "enterprise state is inconsistent",
          ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.UNAVAILABLE, "enterprise server error", ex);
    }
    return new EnterpriseIntegrationException(
        EnterpriseIntegrationException.Reason.BAD_REQUEST,
        message != null ? message : "enterprise request was rejected",
        ex);
  }

  private EnterpriseIntegrationException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("enterprise {} timed out", operation);
      return new EnterpriseIntegrationException(
          EnterpriseIntegrationException.Reason.TIMEOUT, "enterprise request timeout", ex);
    }
    logger.warn("enterprise {} connection failed", operation, ex);
    return new EnterpriseIntegrationException(
        EnterpriseIntegrationException.Reason.UNAVAILABLE, "enterprise connection failed", ex);
  }

  private ApiErrorResponse readError(RestClientResponseException ex) {
    final String body = ex.getResponseBodyAsString();
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ApiErrorResponse.class);
    } catch (JsonProcessingException parseFailure) {
      // エラー本文が JSON でない場合は HTTP ステータスだけで判定する
      logger.debug("enterprise error body is not JSON", parseFailure);
      return null;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

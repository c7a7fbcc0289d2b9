/*
 * どこで: Enterprise クライアント
 * 何を: 環境変数からクラスタ内/開発用の接続先を選ぶ
 * なぜ: 同じクライアントをクラスタ内外で使えるようにするため
 */
package com.example.enterprise.client;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EnterpriseEndpointResolver {

  private static final Logger logger = LoggerFactory.getLogger(EnterpriseEndpointResolver.class);

  static final String HOST_ENV = "ENTERPRISE_SERVICE_HOST";
  static final String PORT_ENV = "ENTERPRISE_SERVICE_PORT";
  private static final String DEFAULT_PORT = "80";

  private final Map<String, String> environment;
  private final String devBaseUrl;

  public EnterpriseEndpointResolver(Map<String, String> environment, String devBaseUrl) {
    this.environment = Map.copyOf(environment);
    this.devBaseUrl = devBaseUrl;
  }

  public static EnterpriseEndpointResolver fromSystemEnvironment(String devBaseUrl) {
    return new EnterpriseEndpointResolver(System.getenv(), devBaseUrl);
  }

  public boolean isInCluster() {
    return hasText(environment.get(HOST_ENV));
  }

  public String resolveBaseUrl() {
    if (isInCluster()) {
      final String port =
          hasText(environment.get(PORT_ENV)) ? environment.get(PORT_ENV).trim() : DEFAULT_PORT;
      final String baseUrl = "http://" + environment.get(HOST_ENV).trim() + ":" + port;
      logger.info("enterprise endpoint resolved mode=in-cluster base_url={}", baseUrl);
      return baseUrl;
    }
    if (!hasText(devBaseUrl)) {
      throw new IllegalStateException(
          HOST_ENV + " is not set and enterprise.client.dev-base-url is empty");
    }
    logger.info("enterprise endpoint resolved mode=development base_url={}", devBaseUrl);
    return devBaseUrl;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}

/*
 * どこで: Enterprise クライアント設定
 * 何を: 開発用接続先とタイムアウト設定を保持する
 * なぜ: クラスタ外から接続する際の URL を外部化するため
 */
package com.example.enterprise.client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "enterprise.client")
public record EnterpriseClientProperties(
    String devBaseUrl, Duration connectTimeout, Duration readTimeout) {

  public EnterpriseClientProperties {
    devBaseUrl = devBaseUrl == null || devBaseUrl.isBlank() ? "http://localhost:8080" : devBaseUrl;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}

/*
 * どこで: Enterprise クライアント設定
 * 何を: enterprise 呼び出し専用 RestClient とクライアント群を一度だけ構築する
 * なぜ: 接続ハンドルを隠れたグローバルにせず、DI で呼び出し側へ渡すため
 */
package com.example.enterprise.client.config;

import com.example.enterprise.client.EnterpriseClient;
import com.example.enterprise.client.EnterpriseEndpointResolver;
import com.example.enterprise.client.EnterpriseStateAwaiter;
import com.example.enterprise.common.config.TimeConfig;
import com.example.enterprise.common.retry.RetryExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({EnterpriseClientProperties.class, EnterpriseRetryProperties.class})
@Import(TimeConfig.class)
public class EnterpriseClientConfig {

  @Bean
  EnterpriseEndpointResolver enterpriseEndpointResolver(EnterpriseClientProperties properties) {
    return EnterpriseEndpointResolver.fromSystemEnvironment(properties.devBaseUrl());
  }

  @Bean
  RestClient enterpriseRestClient(
      RestClient.Builder builder,
      EnterpriseClientProperties properties,
      EnterpriseEndpointResolver endpointResolver) {
    // 接続先解決とタイムアウト設定はここで一度だけ行い、以降はハンドルを使い回す
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder
        .baseUrl(endpointResolver.resolveBaseUrl())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean
  EnterpriseClient enterpriseClient(RestClient enterpriseRestClient, ObjectMapper objectMapper) {
    return new EnterpriseClient(enterpriseRestClient, objectMapper);
  }

  @Bean
  EnterpriseStateAwaiter enterpriseStateAwaiter(
      EnterpriseClient enterpriseClient,
      RetryExecutor retryExecutor,
      EnterpriseRetryProperties retryProperties) {
    return new EnterpriseStateAwaiter(enterpriseClient, retryExecutor, retryProperties.toPolicy());
  }
}

/*
 * どこで: Enterprise Web 設定
 * 何を: RequestMdcInterceptor を enterprise RPC の経路にだけ適用する
 * なぜ: actuator など運用エンドポイントのログに RPC 用キーを混ぜないため
 */
package com.example.enterprise.server.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final String RPC_PATH_PATTERN = "/v1/enterprise/**";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(RPC_PATH_PATTERN);
  }
}

/*
 * どこで: Enterprise Web 層
 * 何を: リクエスト単位の運用キー(request_id/RPC 名/経路/送信元)を MDC に積む
 * なぜ: Activate/Deactivate のログをリクエストと RPC 単位で追跡できるようにするため
 */
package com.example.enterprise.server.config;

import com.example.enterprise.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("request_id", TraceIds.resolve(request.getHeader(REQUEST_ID_HEADER)));
    entries.put("rpc", resolveRpcName(handler));
    entries.put("http_method", request.getMethod());
    entries.put("http_path", request.getRequestURI());
    entries.put("client_ip", resolveClientIp(request));
    entries.values().removeIf(value -> value == null || value.isBlank());
    entries.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, entries.keySet().toArray(String[]::new));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    // スレッドプールで次のリクエストへ値が漏れないよう、積んだキーだけを外す
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof String[] keys) {
      for (String key : keys) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRpcName(Object handler) {
    if (handler instanceof HandlerMethod method) {
      return method.getMethod().getName();
    }
    return null;
  }

  private String resolveClientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    final int comma = forwarded.indexOf(',');
    return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
  }
}

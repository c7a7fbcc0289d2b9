package com.example.enterprise.server.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.enterprise.server.api.EntitlementController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void populatesAndClearsRequestKeys() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/enterprise/activate");
    request.addHeader(RequestMdcInterceptor.REQUEST_ID_HEADER, "req-123");
    request.addHeader("X-Forwarded-For", "203.0.113.5, 10.0.0.1");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-123");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/v1/enterprise/activate");
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.5");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("http_method")).isNull();
    assertThat(MDC.get("http_path")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
  }

  @Test
  void recordsRpcNameFromHandlerMethod() throws Exception {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/enterprise/deactivate");
    final HandlerMethod handler =
        new HandlerMethod(
            new EntitlementController(null),
            EntitlementController.class.getMethod("deactivate"));

    interceptor.preHandle(request, new MockHttpServletResponse(), handler);

    assertThat(MDC.get("rpc")).isEqualTo("deactivate");
  }

  @Test
  void generatesRequestIdWhenHeaderMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/enterprise/state");
    request.setRemoteAddr("192.0.2.10");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("client_ip")).isEqualTo("192.0.2.10");
  }
}

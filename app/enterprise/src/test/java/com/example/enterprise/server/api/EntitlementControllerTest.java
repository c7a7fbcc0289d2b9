/*
 * どこで: Enterprise API のWeb層テスト
 * 何を: エンドポイントの応答形状と例外→ApiErrorResponse 変換を検証する
 * なぜ: クライアントが依存する HTTP 契約を固定するため
 */
package com.example.enterprise.server.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.enterprise.common.model.LicenseState;
import com.example.enterprise.server.model.EnterpriseState;
import com.example.enterprise.server.service.EntitlementService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EntitlementController.class)
@Import(ApiExceptionHandler.class)
class EntitlementControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private EntitlementService entitlementService;

  @Test
  void activateReturnsNoContent() throws Exception {
    final String body =
        """
        {
          "activation_code": "code-1",
          "expires": "2026-03-01T00:00:00Z"
        }
        """;

    mockMvc
        .perform(
            post("/v1/enterprise/activate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isNoContent());

    verify(entitlementService).activate("code-1", Instant.parse("2026-03-01T00:00:00Z"));
  }

  @Test
  void activateWithoutExpiresPassesNull() throws Exception {
    mockMvc
        .perform(
            post("/v1/enterprise/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activation_code\":\"code-1\"}"))
        .andExpect(status().isNoContent());

    verify(entitlementService).activate(eq("code-1"), isNull());
  }

  @Test
  void activatePassesBlankCodeToServiceAndReturnsInvalidCode() throws Exception {
    doThrow(new InvalidActivationCodeException("activation code is required"))
        .when(entitlementService)
        .activate(eq("   "), isNull());

    mockMvc
        .perform(
            post("/v1/enterprise/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activation_code\":\"   \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ACTIVATION_CODE"))
        .andExpect(jsonPath("$.message").value("activation code is required"));

    verify(entitlementService).activate("   ", null);
  }

  @Test
  void activatePassesMissingCodeToService() throws Exception {
    doThrow(new InvalidActivationCodeException("activation code is required"))
        .when(entitlementService)
        .activate(isNull(), isNull());

    mockMvc
        .perform(
            post("/v1/enterprise/activate").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ACTIVATION_CODE"));
  }

  @Test
  void activateReturnsBadRequestWhenBodyMissing() throws Exception {
    mockMvc
        .perform(post("/v1/enterprise/activate").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void activateReturnsBadRequestWhenExpiresMalformed() throws Exception {
    mockMvc
        .perform(
            post("/v1/enterprise/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activation_code\":\"code-1\",\"expires\":\"tomorrow\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void activateMapsInvalidCodeToBadRequest() throws Exception {
    doThrow(new InvalidActivationCodeException("activation code signature is invalid"))
        .when(entitlementService)
        .activate(any(), any());

    mockMvc
        .perform(
            post("/v1/enterprise/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activation_code\":\"forged\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ACTIVATION_CODE"))
        .andExpect(jsonPath("$.message").value("activation code signature is invalid"));
  }

  @Test
  void deactivateReturnsNoContent() throws Exception {
    mockMvc.perform(post("/v1/enterprise/deactivate")).andExpect(status().isNoContent());

    verify(entitlementService).deactivate();
  }

  @Test
  void stateReturnsDerivedStateAndStoredValues() throws Exception {
    when(entitlementService.getState())
        .thenReturn(
            new EnterpriseState(
                LicenseState.EXPIRED, "code-1", Instant.parse("2026-01-16T23:59:30Z")));

    mockMvc
        .perform(get("/v1/enterprise/state"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("EXPIRED"))
        .andExpect(jsonPath("$.activation_code").value("code-1"))
        .andExpect(jsonPath("$.expires").value("2026-01-16T23:59:30Z"));
  }

  @Test
  void stateReturnsNullFieldsWhenNothingIsActive() throws Exception {
    when(entitlementService.getState())
        .thenReturn(new EnterpriseState(LicenseState.NONE, null, null));

    mockMvc
        .perform(get("/v1/enterprise/state"))
        .andExpect(status().isOk())
        .andExpect(
            content().json("{\"state\":\"NONE\",\"activation_code\":null,\"expires\":null}"));
  }

  @Test
  void stateMapsInconsistentRecordToServerError() throws Exception {
    when(entitlementService.getState())
        .thenThrow(new EnterpriseStateInconsistentException("expires_at is set without code"));

    mockMvc
        .perform(get("/v1/enterprise/state"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STATE_INCONSISTENT"));
  }
}

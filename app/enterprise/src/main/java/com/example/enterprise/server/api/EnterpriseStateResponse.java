/*
 * どこで: Enterprise API
 * 何を: GetState のレスポンスを表す
 * なぜ: 導出状態と保存済みのコード/期限をそのまま返すため
 */
package com.example.enterprise.server.api;

import com.example.enterprise.common.model.LicenseState;
import com.example.enterprise.server.model.EnterpriseState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnterpriseStateResponse(LicenseState state, String activationCode, Instant expires) {

  public static EnterpriseStateResponse from(EnterpriseState state) {
    return new EnterpriseStateResponse(state.state(), state.activationCode(), state.expiresAt());
  }
}

/*
 * どこで: Enterprise クライアント
 * 何を: 収束を待つ対象の状態/コード/期限の条件を表す
 * なぜ: ポーリング側の判定を一箇所にまとめるため
 */
package com.example.enterprise.client;

import com.example.enterprise.client.dto.EnterpriseStateResponse;
import com.example.enterprise.common.model.LicenseState;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Conditions a GetState response must meet. Null fields are not checked. Expiry timestamps are
 * compared at whole-second precision.
 */
public record EnterpriseStateExpectation(
    LicenseState state, String activationCode, Instant expires, Instant expiresAbsentOrAfter) {

  public EnterpriseStateExpectation {
    Objects.requireNonNull(state, "state is required");
  }

  public static EnterpriseStateExpectation state(LicenseState state) {
    return new EnterpriseStateExpectation(state, null, null, null);
  }

  public EnterpriseStateExpectation withActivationCode(String code) {
    return new EnterpriseStateExpectation(state, code, expires, expiresAbsentOrAfter);
  }

  public EnterpriseStateExpectation withExpires(Instant instant) {
    return new EnterpriseStateExpectation(state, activationCode, instant, expiresAbsentOrAfter);
  }

  public EnterpriseStateExpectation withExpiresAbsentOrAfter(Instant instant) {
    return new EnterpriseStateExpectation(state, activationCode, expires, instant);
  }

  /** Describes the first unmet condition, empty when the response matches. */
  public Optional<String> mismatch(EnterpriseStateResponse response) {
    if (response.state() != state) {
      return Optional.of(
          "expected enterprise state to be " + state + " but was " + response.state());
    }
    if (activationCode != null && !activationCode.equals(response.activationCode())) {
      return Optional.of(
          "incorrect activation code, got: "
              + response.activationCode()
              + ", expected: "
              + activationCode);
    }
    if (expires != null
        && (response.expires() == null
            || expires.getEpochSecond() != response.expires().getEpochSecond())) {
      return Optional.of(
          "expected enterprise expiration to be " + expires + ", but was " + response.expires());
    }
    if (expiresAbsentOrAfter != null
        && response.expires() != null
        && !response.expires().isAfter(expiresAbsentOrAfter)) {
      return Optional.of(
          "expected enterprise expiration after "
              + expiresAbsentOrAfter
              + ", but was "
              + response.expires());
    }
    return Optional.empty();
  }
}

package com.example.enterprise.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.enterprise.common.model.LicenseState;
import com.example.enterprise.server.ActivationCodeFixtures;
import com.example.enterprise.server.api.InvalidActivationCodeException;
import com.example.enterprise.server.config.EnterpriseActivationProperties;
import com.example.enterprise.server.model.ActivationToken;
import com.example.enterprise.server.model.EnterpriseState;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EntitlementServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  private SimpleMeterRegistry registry;
  private EntitlementService service;

  @BeforeEach
  void setUp() {
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    registry = new SimpleMeterRegistry();
    service =
        new EntitlementService(
            new ActivationCodeValidator(
                new EnterpriseActivationProperties(ActivationCodeFixtures.publicKeyPem()),
                new ObjectMapper(),
                clock),
            new EntitlementStateMachine(clock),
            new EntitlementMetrics(registry));
  }

  @Test
  void activateStoresCodeAndTokenExpiry() {
    final String code = ActivationCodeFixtures.expiringAt(NOW.plusSeconds(3600));

    service.activate(code, null);

    final EnterpriseState state = service.getState();
    assertThat(state.state()).isEqualTo(LicenseState.ACTIVE);
    assertThat(state.activationCode()).isEqualTo(code);
    assertThat(state.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
    assertThat(commandCount("ACTIVATE", "success")).isEqualTo(1.0d);
  }

  @Test
  void requestedPastExpiryYieldsExpiredState() {
    final String code = ActivationCodeFixtures.perpetual();

    service.activate(code, NOW.minusSeconds(30));

    final EnterpriseState state = service.getState();
    assertThat(state.state()).isEqualTo(LicenseState.EXPIRED);
    assertThat(state.expiresAt()).isEqualTo(NOW.minusSeconds(30));
  }

  @Test
  void invalidCodeLeavesStateUntouched() {
    service.activate(ActivationCodeFixtures.perpetual(), null);

    assertThatThrownBy(() -> service.activate(ActivationCodeFixtures.signedByOtherKey(), null))
        .isInstanceOf(InvalidActivationCodeException.class);

    final EnterpriseState state = service.getState();
    assertThat(state.state()).isEqualTo(LicenseState.ACTIVE);
    assertThat(state.activationCode()).isEqualTo(ActivationCodeFixtures.perpetual());
    assertThat(commandCount("ACTIVATE", "invalid_code")).isEqualTo(1.0d);
  }

  @Test
  void blankCodeIsRejectedByValidatorAndCounted() {
    assertThatThrownBy(() -> service.activate("   ", null))
        .isInstanceOf(InvalidActivationCodeException.class)
        .hasMessage("activation code is required");
    assertThatThrownBy(() -> service.activate(null, null))
        .isInstanceOf(InvalidActivationCodeException.class);

    assertThat(service.getState().state()).isEqualTo(LicenseState.NONE);
    assertThat(commandCount("ACTIVATE", "invalid_code")).isEqualTo(2.0d);
  }

  @Test
  void deactivateTwiceSucceeds() {
    service.activate(ActivationCodeFixtures.perpetual(), null);

    service.deactivate();
    service.deactivate();

    assertThat(service.getState().state()).isEqualTo(LicenseState.NONE);
    assertThat(commandCount("DEACTIVATE", "success")).isEqualTo(2.0d);
  }

  @Test
  void getStateRecordsReadsByState() {
    service.getState();
    service.getState();

    assertThat(registry.get("enterprise.state.read.total").tag("state", "NONE").counter().count())
        .isEqualTo(2.0d);
  }

  @Test
  void requestedExpiryCanShortenButNotExtendToken() {
    final Instant tokenExpiry = NOW.plusSeconds(3600);
    final ActivationToken token = new ActivationToken(tokenExpiry);

    assertThat(EntitlementService.resolveExpiresAt(token, null)).isEqualTo(tokenExpiry);
    assertThat(EntitlementService.resolveExpiresAt(token, NOW.plusSeconds(60)))
        .isEqualTo(NOW.plusSeconds(60));
    assertThat(EntitlementService.resolveExpiresAt(token, NOW.plusSeconds(7200)))
        .isEqualTo(tokenExpiry);
    assertThat(EntitlementService.resolveExpiresAt(new ActivationToken(null), NOW))
        .isEqualTo(NOW);
    assertThat(EntitlementService.resolveExpiresAt(new ActivationToken(null), null)).isNull();
  }

  private double commandCount(String action, String result) {
    return registry
        .get("enterprise.command.total")
        .tag("action", action)
        .tag("result", result)
        .counter()
        .count();
  }
}

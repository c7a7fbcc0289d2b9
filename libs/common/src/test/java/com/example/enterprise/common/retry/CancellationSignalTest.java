package com.example.enterprise.common.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Test
  void cancelFiresSignal() throws Exception {
    final CancellationSignal signal = CancellationSignal.create();
    final ManualClock clock = new ManualClock(NOW);

    assertThat(signal.isCancelled(clock)).isFalse();
    signal.cancel();

    assertThat(signal.isCancelled(clock)).isTrue();
    assertThat(signal.await(Duration.ofMinutes(1))).isTrue();
  }

  @Test
  void deadlineFiresOnceReached() {
    final ManualClock clock = new ManualClock(NOW);
    final CancellationSignal signal = CancellationSignal.withDeadline(NOW.plusSeconds(1));

    assertThat(signal.isCancelled(clock)).isFalse();
    clock.advance(Duration.ofSeconds(1));
    assertThat(signal.isCancelled(clock)).isTrue();
    assertThat(signal.deadline()).contains(NOW.plusSeconds(1));
  }

  @Test
  void awaitTimesOutWithoutCancel() throws Exception {
    final CancellationSignal signal = CancellationSignal.create();

    assertThat(signal.await(Duration.ofMillis(10))).isFalse();
    assertThat(signal.await(Duration.ZERO)).isFalse();
  }

  @Test
  void deadlineIsRequired() {
    assertThatThrownBy(() -> CancellationSignal.withDeadline(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

/*
 * どこで: Enterprise サービス層
 * 何を: ライセンス操作のアプリ固有メトリクス記録を集約する
 * なぜ: Activate 失敗率と状態の読み取り傾向を運用で継続監視できるようにするため
 */
package com.example.enterprise.server.service;

import com.example.enterprise.common.model.LicenseState;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class EntitlementMetrics {

  private static final String METRIC_COMMAND_TOTAL = "enterprise.command.total";
  private static final String METRIC_STATE_READ_TOTAL = "enterprise.state.read.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<LicenseState, Counter> stateReadCounters = new ConcurrentHashMap<>();

  public EntitlementMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Enterprise license command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStateRead(LicenseState state) {
    stateReadCounters
        .computeIfAbsent(
            state,
            ignored ->
                Counter.builder(METRIC_STATE_READ_TOTAL)
                    .description("Enterprise license state reads by derived state")
                    .tag("state", state.name())
                    .register(meterRegistry))
        .increment();
  }
}

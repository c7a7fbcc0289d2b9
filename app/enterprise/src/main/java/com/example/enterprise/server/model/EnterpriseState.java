/*
 * どこで: Enterprise ドメインモデル
 * 何を: GetState の読み取り結果(導出状態 + 保存値)を表す
 * なぜ: API 応答とテストで同じスナップショットを扱うため
 */
package com.example.enterprise.server.model;

import com.example.enterprise.common.model.LicenseState;
import java.time.Instant;

public record EnterpriseState(LicenseState state, String activationCode, Instant expiresAt) {
}

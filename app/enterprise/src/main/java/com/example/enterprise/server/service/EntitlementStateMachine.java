/*
 * どこで: Enterprise サービス層
 * 何を: 唯一の entitlement レコードを排他ロック下で更新/参照する
 * なぜ: 書きかけのレコードを観測させず、状態を読み取り時に導出するため
 */
package com.example.enterprise.server.service;

import com.example.enterprise.common.model.LicenseState;
import com.example.enterprise.server.api.EnterpriseStateInconsistentException;
import com.example.enterprise.server.model.EnterpriseState;
import com.example.enterprise.server.model.EntitlementRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

@Component
public class EntitlementStateMachine {

  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;
  private EntitlementRecord record = EntitlementRecord.empty();

  public EntitlementStateMachine(Clock clock) {
    this.clock = clock;
  }

  /** Overwrites the record regardless of the current state. */
  public void activate(String activationCode, Instant expiresAt) {
    if (activationCode == null || activationCode.isBlank()) {
      throw new IllegalArgumentException("activationCode is required");
    }
    final EntitlementRecord next = new EntitlementRecord(activationCode, expiresAt);
    lock.lock();
    try {
      record = next;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Clears the record. Succeeds when nothing is active.
   *
   * @return whether an activation code was present before the call
   */
  public boolean deactivate() {
    lock.lock();
    try {
      final boolean hadActivation = !record.isEmpty();
      record = EntitlementRecord.empty();
      return hadActivation;
    } finally {
      lock.unlock();
    }
  }

  public EnterpriseState getState() {
    lock.lock();
    try {
      final EntitlementRecord current = record;
      final LicenseState state = deriveState(current, Instant.now(clock));
      return new EnterpriseState(state, current.activationCode(), current.expiresAt());
    } finally {
      lock.unlock();
    }
  }

  public void reset() {
    lock.lock();
    try {
      record = EntitlementRecord.empty();
    } finally {
      lock.unlock();
    }
  }

  static LicenseState deriveState(EntitlementRecord record, Instant now) {
    if (record.activationCode() == null) {
      if (record.expiresAt() != null) {
        throw new EnterpriseStateInconsistentException(
            "expires_at is set without an activation code");
      }
      return LicenseState.NONE;
    }
    // 期限ちょうどは EXPIRED とし、expiresAt > now の間だけ ACTIVE
    if (record.expiresAt() == null || record.expiresAt().isAfter(now)) {
      return LicenseState.ACTIVE;
    }
    return LicenseState.EXPIRED;
  }
}

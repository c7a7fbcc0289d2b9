/*
 * どこで: Enterprise ドメインモデル
 * 何を: サービスが保持する唯一の entitlement レコードを表す
 * なぜ: 状態を保存せず、コードと期限から毎回導出するため
 */
package com.example.enterprise.server.model;

import java.time.Instant;

public record EntitlementRecord(String activationCode, Instant expiresAt) {

    private static final EntitlementRecord EMPTY = new EntitlementRecord(null, null);

    public static EntitlementRecord empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return activationCode == null && expiresAt == null;
    }
}

/*
 * どこで: Enterprise API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.enterprise.server.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    INVALID_ACTIVATION_CODE,
    STATE_INCONSISTENT
}

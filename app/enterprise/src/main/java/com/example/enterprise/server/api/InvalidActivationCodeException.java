/*
 * どこで: Enterprise API
 * 何を: activation code の検証失敗(400)を表す例外を定義する
 * なぜ: リトライ不可の入力エラーとして即時に呼び出し元へ返すため
 */
package com.example.enterprise.server.api;

public class InvalidActivationCodeException extends RuntimeException {

    public InvalidActivationCodeException(String message) {
        super(message);
    }

    public InvalidActivationCodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * どこで: Enterprise API
 * 何を: 保存レコードの不変条件違反(500)を表す例外を定義する
 * なぜ: 黙って回復せず、不具合として記録するため
 */
package com.example.enterprise.server.api;

public class EnterpriseStateInconsistentException extends RuntimeException {

    public EnterpriseStateInconsistentException(String message) {
        super(message);
    }
}

/*
 * どこで: Enterprise アプリの設定バインド
 * 何を: activation code 署名検証用の公開鍵(PEM)を保持する
 * なぜ: 鍵を環境ごとに差し替えられるようにするため
 */
package com.example.enterprise.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "enterprise.activation")
public record EnterpriseActivationProperties(String publicKey) {}

/*
 * どこで: Enterprise API
 * 何を: Activate リクエストの入力を保持する
 * なぜ: 空のコードも検証器まで届け、INVALID_ACTIVATION_CODE として返すため
 */
package com.example.enterprise.server.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActivateRequest(String activationCode, Instant expires) {}

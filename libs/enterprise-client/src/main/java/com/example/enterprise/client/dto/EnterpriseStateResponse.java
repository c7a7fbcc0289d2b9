/*
 * どこで: Enterprise クライアント DTO
 * 何を: GetState 応答(状態/コード/期限)を受け取る
 * なぜ: サーバ応答の JSON 形状をクライアント側で型付けするため
 */
package com.example.enterprise.client.dto;

import com.example.enterprise.common.model.LicenseState;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnterpriseStateResponse(LicenseState state, String activationCode, Instant expires) {}

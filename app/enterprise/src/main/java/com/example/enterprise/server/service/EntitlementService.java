/*
 * どこで: Enterprise サービス層
 * 何を: activation code の検証と状態機械の更新/参照をまとめる
 * なぜ: RPC ごとに自己完結した原子的操作として公開するため
 */
package com.example.enterprise.server.service;

import com.example.enterprise.server.api.InvalidActivationCodeException;
import com.example.enterprise.server.model.ActivationToken;
import com.example.enterprise.server.model.EnterpriseState;

import lombok.RequiredArgsConstructor;

import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EntitlementService {

    private static final Logger logger = LoggerFactory.getLogger(EntitlementService.class);

    private static final String ACTION_ACTIVATE = "ACTIVATE";
    private static final String ACTION_DEACTIVATE = "DEACTIVATE";
    private static final String RESULT_SUCCESS = "success";
    private static final String RESULT_INVALID_CODE = "invalid_code";

    private final ActivationCodeValidator activationCodeValidator;
    private final EntitlementStateMachine stateMachine;
    private final EntitlementMetrics metrics;

    public void activate(String activationCode, Instant requestedExpiresAt) {
        // 検証はロック外で行い、失敗時は状態に触れない
        final ActivationToken token;
        try {
            token = activationCodeValidator.validate(activationCode);
        } catch (InvalidActivationCodeException ex) {
            metrics.recordCommand(ACTION_ACTIVATE, RESULT_INVALID_CODE);
            logger.warn("enterprise activation rejected reason={}", ex.getMessage());
            throw ex;
        }
        final Instant expiresAt = resolveExpiresAt(token, requestedExpiresAt);
        stateMachine.activate(activationCode, expiresAt);
        metrics.recordCommand(ACTION_ACTIVATE, RESULT_SUCCESS);
        logger.info("enterprise activated expires_at={}", expiresAt);
    }

    public void deactivate() {
        final boolean hadActivation = stateMachine.deactivate();
        metrics.recordCommand(ACTION_DEACTIVATE, RESULT_SUCCESS);
        if (hadActivation) {
            logger.info("enterprise deactivated");
        } else {
            logger.info("enterprise deactivate requested while no activation code is stored");
        }
    }

    public EnterpriseState getState() {
        final EnterpriseState state = stateMachine.getState();
        metrics.recordStateRead(state.state());
        return state;
    }

    /**
     * A requested expiry may shorten the token's validity but never extend it.
     */
    static Instant resolveExpiresAt(ActivationToken token, Instant requestedExpiresAt) {
        final Instant tokenExpiresAt = token.expiresAt();
        if (requestedExpiresAt == null) {
            return tokenExpiresAt;
        }
        if (tokenExpiresAt == null || requestedExpiresAt.isBefore(tokenExpiresAt)) {
            return requestedExpiresAt;
        }
        return tokenExpiresAt;
    }
}

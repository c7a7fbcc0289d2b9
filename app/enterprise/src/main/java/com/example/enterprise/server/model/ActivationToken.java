package com.example.enterprise.server.model;

import java.time.Instant;

/** Verified content of an activation code. {@code expiresAt} is null for perpetual codes. */
public record ActivationToken(Instant expiresAt) {
}

/*
 * どこで: Enterprise サービス補助
 * 何を: activation code の形式と RSA 署名をオフラインで検証する
 * なぜ: ロック内でネットワーク呼び出しをせずに入力を弾くため
 */
package com.example.enterprise.server.service;

import com.example.enterprise.server.api.InvalidActivationCodeException;
import com.example.enterprise.server.config.EnterpriseActivationProperties;
import com.example.enterprise.server.model.ActivationToken;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import org.springframework.stereotype.Component;

/**
 * Validates activation codes of the form
 * {@code base64({"token": "<json>", "signature": "<base64>"})} where {@code signature} is a
 * {@code SHA256withRSA} signature over the UTF-8 bytes of {@code token}, and {@code token} is
 * {@code {"expiry": "<ISO-8601>"}} with an optional expiry.
 */
@Component
public class ActivationCodeValidator {

  private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  private static final String KEY_ALGORITHM = "RSA";

  private final PublicKey publicKey;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ActivationCodeValidator(
      EnterpriseActivationProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.publicKey = parsePublicKey(properties.publicKey());
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public ActivationToken validate(String activationCode) {
    if (activationCode == null || activationCode.isBlank()) {
      throw new InvalidActivationCodeException("activation code is required");
    }
    final SignedActivationCode signed = decode(activationCode);
    verifySignature(signed);
    final Instant expiresAt = parseExpiry(signed.token());
    if (expiresAt != null && !expiresAt.isAfter(Instant.now(clock))) {
      throw new InvalidActivationCodeException("activation code has expired");
    }
    return new ActivationToken(expiresAt);
  }

  private SignedActivationCode decode(String activationCode) {
    final byte[] decoded;
    try {
      decoded = Base64.getDecoder().decode(activationCode.trim());
    } catch (IllegalArgumentException ex) {
      throw new InvalidActivationCodeException("activation code is not valid base64", ex);
    }
    final SignedActivationCode signed;
    try {
      signed = objectMapper.readValue(decoded, SignedActivationCode.class);
    } catch (IOException ex) {
      throw new InvalidActivationCodeException("activation code is not valid JSON", ex);
    }
    if (signed == null || isBlank(signed.token()) || isBlank(signed.signature())) {
      throw new InvalidActivationCodeException("activation code is missing token or signature");
    }
    return signed;
  }

  private void verifySignature(SignedActivationCode signed) {
    final byte[] signatureBytes;
    try {
      signatureBytes = Base64.getDecoder().decode(signed.signature());
    } catch (IllegalArgumentException ex) {
      throw new InvalidActivationCodeException("activation code signature is not valid base64", ex);
    }
    final boolean verified;
    try {
      final Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
      verifier.initVerify(publicKey);
      verifier.update(signed.token().getBytes(StandardCharsets.UTF_8));
      verified = verifier.verify(signatureBytes);
    } catch (SignatureException ex) {
      throw new InvalidActivationCodeException("activation code signature is invalid", ex);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("activation code verifier is unavailable", ex);
    }
    if (!verified) {
      throw new InvalidActivationCodeException("activation code signature is invalid");
    }
  }

  private Instant parseExpiry(String token) {
    final ActivationTokenBody body;
    try {
      body = objectMapper.readValue(token, ActivationTokenBody.class);
    } catch (IOException ex) {
      throw new InvalidActivationCodeException("activation token is not valid JSON", ex);
    }
    if (body == null || isBlank(body.expiry())) {
      return null;
    }
    try {
      return Instant.parse(body.expiry());
    } catch (DateTimeParseException ex) {
      throw new InvalidActivationCodeException("activation token expiry is invalid", ex);
    }
  }

  static PublicKey parsePublicKey(String pem) {
    if (isBlank(pem)) {
      throw new IllegalStateException("enterprise.activation.public-key is required");
    }
    final String base64 =
        pem.replace("-----BEGIN PUBLIC KEY-----", "")
            .replace("-----END PUBLIC KEY-----", "")
            .replaceAll("\\s", "");
    try {
      final byte[] der = Base64.getDecoder().decode(base64);
      return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
    } catch (IllegalArgumentException | GeneralSecurityException ex) {
      throw new IllegalStateException("enterprise.activation.public-key is invalid", ex);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SignedActivationCode(String token, String signature) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ActivationTokenBody(String expiry) {}
}

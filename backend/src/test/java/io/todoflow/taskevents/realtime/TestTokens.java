package io.todoflow.taskevents.realtime;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/** Signs WebSocket tokens the way the authentication service issues them. */
final class TestTokens {

  static final String SECRET = "test-websocket-secret-0123456789-abcdefghijklmnopqrstuvwxyz-ABCDEF";

  private TestTokens() {}

  static String token(String subject, Instant expiresAt) {
    return sign(SECRET, JWSAlgorithm.HS256, subject, expiresAt);
  }

  static String sign(String secret, JWSAlgorithm algorithm, String subject, Instant expiresAt) {
    var claims =
        new JWTClaimsSet.Builder()
            .jwtID(UUID.randomUUID().toString())
            .subject(subject)
            .issueTime(Date.from(expiresAt.minusSeconds(3600)))
            .expirationTime(Date.from(expiresAt))
            .build();
    var signedJwt = new SignedJWT(new JWSHeader(algorithm), claims);
    try {
      signedJwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign test token", e);
    }
    return signedJwt.serialize();
  }
}

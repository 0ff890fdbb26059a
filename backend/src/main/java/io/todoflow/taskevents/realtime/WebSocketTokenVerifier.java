package io.todoflow.taskevents.realtime;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies the HS256 JWT a client presents when opening a WebSocket. Tokens are issued by the
 * authentication service; the subject is the user id.
 */
@Service
public class WebSocketTokenVerifier {

  private final byte[] secret;
  private final Clock clock;

  public WebSocketTokenVerifier(
      @Value("${taskflow.websocket.jwt-secret}") String jwtSecret, Clock clock) {
    this.secret = jwtSecret.getBytes(StandardCharsets.UTF_8);
    this.clock = clock;
  }

  /**
   * Verifies signature and expiry and returns the user id.
   *
   * @throws WebSocketAuthException if the token is missing, malformed, forged or expired
   */
  public String verify(String token) {
    if (token == null || token.isBlank()) {
      throw new WebSocketAuthException("Missing token");
    }
    try {
      var signedJwt = SignedJWT.parse(token);
      if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())) {
        throw new WebSocketAuthException("Unsupported token algorithm");
      }
      JWSVerifier verifier = new MACVerifier(secret);
      if (!signedJwt.verify(verifier)) {
        throw new WebSocketAuthException("Invalid token signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
        throw new WebSocketAuthException("Token has expired");
      }
      String subject = claims.getSubject();
      if (subject == null || subject.isBlank()) {
        throw new WebSocketAuthException("Token has no subject");
      }
      return subject;
    } catch (ParseException | JOSEException e) {
      throw new WebSocketAuthException("Invalid token: " + e.getMessage());
    }
  }
}

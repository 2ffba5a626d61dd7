package com.dotplatform.common.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Verifies bearer tokens issued by the identity provider.
 *
 * <h3>Claims</h3>
 * <pre>
 *   Payload: {"sub": "123",      user id
 *             "role": "DRIVER",  CUSTOMER | DRIVER | ADMIN
 *             "exp": 1700003600}
 *   Signature: HMACSHA256(header + "." + payload, secretKey)
 * </pre>
 *
 * Token issuance lives with the identity provider; this component only parses.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;

    public JwtTokenProvider(
            @Value("${dot.jwt.secret:dotPlatformDevelopmentSecretKeyThatIsLongEnough}") String secret) {
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    /**
     * Parses and verifies the token. Empty when the signature, expiry, subject or role is invalid.
     */
    public Optional<AuthenticatedUser> authenticate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            Long userId = Long.parseLong(claims.getSubject());
            UserRole role = UserRole.valueOf(claims.get(ROLE_CLAIM, String.class).toUpperCase());
            return Optional.of(new AuthenticatedUser(userId, role));
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

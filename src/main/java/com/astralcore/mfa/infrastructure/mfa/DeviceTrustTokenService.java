package com.astralcore.mfa.infrastructure.mfa;

import com.astralcore.mfa.config.MfaProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Signed "remember this device" tokens: subject is the user id, issued-at is the grant time, and the token id
 * ties the token to a revocable trusted device record.
 */
@Component
public class DeviceTrustTokenService {

    private static final Logger log = LoggerFactory.getLogger(DeviceTrustTokenService.class);

    private final Key key;
    private final Duration ttl;
    private final Clock clock;

    public DeviceTrustTokenService(
            @Value("${app.mfa.trusted-devices.signing-secret}") String secret,
            MfaProperties properties,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = Duration.ofDays(properties.getTrustedDevices().getExpiryDays());
        this.clock = clock;
        log.info("Device trust tokens initialized with TTL: {} days", ttl.toDays());
    }

    public IssuedToken issue(String userId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .setSubject(userId)
                .setId(tokenId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedToken(token, tokenId,
                OffsetDateTime.ofInstant(now, ZoneOffset.UTC),
                OffsetDateTime.ofInstant(expiresAt, ZoneOffset.UTC));
    }

    /**
     * @return the token id if the token is authentic, unexpired and belongs to {@code userId}
     */
    public Optional<String> validate(String userId, String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            if (!userId.equals(claims.getSubject())) {
                log.warn("Device trust token presented for another user: {}", userId);
                return Optional.empty();
            }
            return Optional.ofNullable(claims.getId());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected device trust token for user {}: {}", userId, e.getMessage());
            return Optional.empty();
        }
    }

    public record IssuedToken(String token, String tokenId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {}
}

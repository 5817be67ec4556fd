package com.astralcore.mfa.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.*;

/**
 * Bearer tokens of the primary authentication layer. MFA only reads them; {@link #generateToken} exists for
 * the identity service and for tests.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    public String generateToken(String subjectEmail, String userId, Set<String> roles) {
        Instant now = Instant.now();
        Date iat = Date.from(now);
        Date exp = Date.from(now.plusSeconds(ttlSeconds));

        log.debug("Generating JWT token for user: {}, roles: {}", userId, roles);

        return Jwts.builder()
                .setSubject(subjectEmail)
                .setIssuedAt(iat)
                .setExpiration(exp)
                .claim("uid", userId)
                .claim("roles", roles == null ? List.of() : new ArrayList<>(roles))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> getUserId(String token) {
        try {
            Object uid = parse(token).getBody().get("uid");
            return Optional.ofNullable(uid == null ? null : String.valueOf(uid));
        } catch (Exception e) {
            log.warn("Failed to extract user id from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> getRoles(String token) {
        try {
            Object rolesObj = parse(token).getBody().get("roles");

            if (rolesObj instanceof Collection<?> col) {
                Set<String> roles = new HashSet<>();
                for (Object o : col) {
                    roles.add(String.valueOf(o));
                }
                return roles;
            }

            log.debug("No roles found in token");
            return Set.of();
        } catch (Exception e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public boolean isTokenExpired(String token) {
        try {
            return parse(token).getBody().getExpiration().before(new Date());
        } catch (Exception e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return true;
        }
    }
}

package com.prediction.market.settlement_engine.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;

import javax.crypto.SecretKey;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues and validates HMAC-signed bearer tokens. The subject is the user id;
 * the "roles" claim carries role names without the ROLE_ prefix.
 */
@Slf4j
public class JwtUtil {

    static final String ROLES_CLAIM = "roles";
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration tokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtUtil(String secret, Duration tokenTtl, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("settlement.security.jwt-secret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = tokenTtl;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String generateToken(String userId, Collection<String> roles) {
        Date issuedAt = Date.from(clock.instant());
        return Jwts.builder()
                .subject(userId)
                .claim(ROLES_CLAIM, List.copyOf(roles))
                .issuedAt(issuedAt)
                .expiration(Date.from(clock.instant().plus(tokenTtl)))
                .signWith(key)
                .compact();
    }

    /**
     * @return the token's identity, or empty if the token is malformed, forged or expired
     */
    public Optional<TokenIdentity> validateToken(String token) {
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            if (claims.getSubject() == null || claims.getSubject().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new TokenIdentity(claims.getSubject(), roles(claims)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> roles(Claims claims) {
        Object raw = claims.get(ROLES_CLAIM);
        if (raw instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public record TokenIdentity(String userId, List<String> roles) {
    }
}

package com.storefront.backend.security;

import com.storefront.backend.config.AuthProperties;
import com.storefront.backend.config.AuthSecrets;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and parses HS256-signed access and refresh tokens.
 *
 * Access and refresh tokens are signed with different keys, so a token of
 * one kind never parses as the other. Expiry is checked against the
 * {@code now} supplied by the caller.
 */
@Slf4j
@Component
public class SignedTokenCodec {

    static final String KIND_CLAIM = "typ";

    private final Map<TokenKind, SecretKey> keys = new EnumMap<>(TokenKind.class);
    private final Map<TokenKind, Duration> lifetimes = new EnumMap<>(TokenKind.class);

    public SignedTokenCodec(AuthSecrets secrets, AuthProperties properties) {
        keys.put(TokenKind.ACCESS, Keys.hmacShaKeyFor(secrets.access()));
        keys.put(TokenKind.REFRESH, Keys.hmacShaKeyFor(secrets.refresh()));
        lifetimes.put(TokenKind.ACCESS, properties.getAccessTokenTtl());
        lifetimes.put(TokenKind.REFRESH, properties.getRefreshTokenTtl());
    }

    public Duration lifetime(TokenKind kind) {
        return lifetimes.get(kind);
    }

    public String issue(TokenKind kind, long subjectId, Instant now) {
        Instant expiresAt = now.plus(lifetime(kind));
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(Long.toString(subjectId))
                .claim(KIND_CLAIM, kind.claimValue())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(keys.get(kind), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Returns the claims of a structurally valid, correctly signed and
     * unexpired token of the given kind, or empty. The cause of a rejection
     * is logged, never returned.
     */
    public Optional<TokenClaims> parse(String token, TokenKind kind, Instant now) {
        if (token == null || token.isBlank()) {
            log.debug("Rejected {} token: empty", kind);
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keys.get(kind))
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            if (!kind.claimValue().equals(claims.get(KIND_CLAIM, String.class))) {
                log.warn("Rejected {} token: kind claim mismatch", kind);
                return Optional.empty();
            }
            String subject = claims.getSubject();
            if (subject == null || subject.isEmpty() || !subject.chars().allMatch(Character::isDigit)) {
                log.warn("Rejected {} token: missing or non-numeric subject", kind);
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(
                    Long.parseLong(subject),
                    kind,
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant()));
        } catch (ExpiredJwtException e) {
            log.debug("Rejected {} token: expired at {}", kind, e.getClaims().getExpiration());
        } catch (SignatureException e) {
            log.warn("Rejected {} token: bad signature", kind);
        } catch (JwtException e) {
            log.warn("Rejected {} token: malformed ({})", kind, e.getMessage());
        }
        return Optional.empty();
    }
}

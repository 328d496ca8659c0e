package com.storefront.backend.service;

import com.storefront.backend.exception.UpstreamUnavailableException;
import com.storefront.backend.security.CredentialCheck;
import com.storefront.backend.security.CredentialVerifier;
import com.storefront.backend.security.MagicLinkCodec;
import com.storefront.backend.security.SignedTokenCodec;
import com.storefront.backend.security.TokenClaims;
import com.storefront.backend.security.TokenKind;
import com.storefront.backend.service.session.SessionCache;
import com.storefront.backend.service.session.SessionKeys;
import com.storefront.backend.service.session.SessionRecord;
import com.storefront.backend.util.LogRedaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns verified credentials into access/refresh tokens, checks them on later
 * requests, rotates them and revokes them.
 *
 * <p>A token is active only while its signature and expiry hold <em>and</em> the
 * session cache still has an entry for it. Deleting the entry revokes the token
 * before its embedded expiry.
 *
 * <p>Every public operation reports failure as an empty result or {@code false}.
 * The failure kind and cause are logged here and never returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionAuthority {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int MAX_SECRET_BYTES = 72;

    private final CredentialVerifier credentialVerifier;
    private final SignedTokenCodec tokenCodec;
    private final MagicLinkCodec magicLinkCodec;
    private final SessionCache sessionCache;
    private final AuthMetrics authMetrics;
    private final Clock clock;

    /**
     * Password login. Unknown identifiers and wrong passwords fail identically.
     */
    public Optional<SessionTokens> login(String identifier, String secret) {
        return boundary("login", () -> {
            requireCredentialShape(identifier, secret);
            CredentialCheck check = credentialVerifier.verify(identifier, secret);
            if (!check.isVerified()) {
                throw new SessionAuthorityException(AuthFailureKind.AUTHENTICATION_FAILED,
                        "Bad credentials for " + LogRedaction.maskEmail(identifier) + " (" + check.outcome() + ")");
            }
            return mintSession(check.subjectId());
        });
    }

    /**
     * Mints one access and one refresh token for the subject and registers both.
     * The only path that produces a refresh token.
     */
    public Optional<SessionTokens> createSession(long subjectId) {
        return boundary("createSession", () -> mintSession(subjectId));
    }

    public boolean verifySession(String accessToken) {
        return boundary("verifySession", () -> {
            TokenClaims claims = parse(accessToken, TokenKind.ACCESS);
            SessionRecord record = sessionCache.get(SessionKeys.access(accessToken))
                    .orElseThrow(() -> new SessionAuthorityException(AuthFailureKind.SESSION_NOT_FOUND,
                            "No live session for access token"));
            requireSameSubject(claims, record);
            return Boolean.TRUE;
        }).orElse(false);
    }

    /**
     * Logout. Succeeds only if a live entry was actually removed.
     */
    public boolean deleteSession(String accessToken) {
        return boundary("deleteSession", () -> {
            requirePresent(accessToken, "access token");
            if (!sessionCache.delete(SessionKeys.access(accessToken))) {
                throw new SessionAuthorityException(AuthFailureKind.SESSION_NOT_FOUND,
                        "No session to delete for access token");
            }
            return Boolean.TRUE;
        }).orElse(false);
    }

    /**
     * Exchanges a refresh token for a new access token. The refresh entry is
     * claimed and removed atomically, so each refresh token rotates once.
     * No new refresh token is minted.
     */
    public Optional<String> refreshSession(String refreshToken) {
        return boundary("refreshSession", () -> {
            TokenClaims claims = parse(refreshToken, TokenKind.REFRESH);
            SessionRecord record = sessionCache.take(SessionKeys.refresh(refreshToken))
                    .orElseThrow(() -> new SessionAuthorityException(AuthFailureKind.SESSION_NOT_FOUND,
                            "Refresh token not found or already rotated"));
            requireSameSubject(claims, record);
            String accessToken = tokenCodec.issue(TokenKind.ACCESS, record.subjectId(), clock.instant());
            sessionCache.put(SessionKeys.access(accessToken), record, tokenCodec.lifetime(TokenKind.ACCESS));
            return accessToken;
        });
    }

    /**
     * Drops a refresh token's cache entry so it can no longer be rotated.
     */
    public boolean revokeRefreshToken(String refreshToken) {
        return boundary("revokeRefreshToken", () -> {
            requirePresent(refreshToken, "refresh token");
            if (!sessionCache.delete(SessionKeys.refresh(refreshToken))) {
                throw new SessionAuthorityException(AuthFailureKind.SESSION_NOT_FOUND,
                        "No refresh entry to revoke");
            }
            return Boolean.TRUE;
        }).orElse(false);
    }

    public Optional<String> issueMagicLink(String email) {
        return boundary("issueMagicLink", () -> magicLinkCodec.issue(email, clock.instant())
                .orElseThrow(() -> new SessionAuthorityException(AuthFailureKind.INVALID_INPUT,
                        "Magic link requested for empty email")));
    }

    /**
     * Returns the email a valid magic link was issued for. Does not create a
     * session; see {@link MagicLinkSignInService}.
     */
    public Optional<String> redeemMagicLink(String token) {
        return boundary("redeemMagicLink", () -> magicLinkCodec.redeem(token, clock.instant())
                .orElseThrow(() -> new SessionAuthorityException(AuthFailureKind.TOKEN_INVALID,
                        "Magic link invalid or expired")));
    }

    private SessionTokens mintSession(long subjectId) {
        if (subjectId <= 0) {
            throw new SessionAuthorityException(AuthFailureKind.INVALID_INPUT, "Non-positive subject id " + subjectId);
        }
        Instant now = clock.instant();
        SessionRecord record = new SessionRecord(subjectId);
        String accessToken = tokenCodec.issue(TokenKind.ACCESS, subjectId, now);
        String refreshToken = tokenCodec.issue(TokenKind.REFRESH, subjectId, now);
        sessionCache.put(SessionKeys.access(accessToken), record, tokenCodec.lifetime(TokenKind.ACCESS));
        sessionCache.put(SessionKeys.refresh(refreshToken), record, tokenCodec.lifetime(TokenKind.REFRESH));
        log.info("Session created for subject {}", subjectId);
        return new SessionTokens(accessToken, refreshToken);
    }

    private TokenClaims parse(String token, TokenKind kind) {
        requirePresent(token, kind.claimValue() + " token");
        return tokenCodec.parse(token, kind, clock.instant())
                .orElseThrow(() -> new SessionAuthorityException(AuthFailureKind.TOKEN_INVALID,
                        "Invalid " + kind.claimValue() + " token"));
    }

    private void requireSameSubject(TokenClaims claims, SessionRecord record) {
        if (claims.subjectId() != record.subjectId()) {
            throw new SessionAuthorityException(AuthFailureKind.TOKEN_INVALID,
                    "Session subject does not match token subject");
        }
    }

    private void requireCredentialShape(String identifier, String secret) {
        if (identifier == null || !EMAIL_PATTERN.matcher(identifier).matches()) {
            throw new SessionAuthorityException(AuthFailureKind.INVALID_INPUT, "Malformed identifier");
        }
        if (secret == null || secret.isBlank()
                || secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES) {
            throw new SessionAuthorityException(AuthFailureKind.INVALID_INPUT, "Malformed secret");
        }
    }

    private void requirePresent(String token, String name) {
        if (token == null || token.isBlank()) {
            throw new SessionAuthorityException(AuthFailureKind.INVALID_INPUT, "Missing " + name);
        }
    }

    private <T> Optional<T> boundary(String operation, Supplier<T> action) {
        try {
            T result = action.get();
            authMetrics.recordSuccess(operation);
            log.debug("{} succeeded", operation);
            return Optional.of(result);
        } catch (SessionAuthorityException e) {
            authMetrics.recordFailure(operation, e.getKind());
            log.warn("{} failed kind={} reason={}", operation, e.getKind(), e.getMessage());
        } catch (UpstreamUnavailableException e) {
            authMetrics.recordFailure(operation, AuthFailureKind.UPSTREAM_UNAVAILABLE);
            log.error("{} failed kind={} retryable=true reason={}",
                    operation, AuthFailureKind.UPSTREAM_UNAVAILABLE, e.getMessage(), e);
        } catch (RuntimeException e) {
            authMetrics.recordUnexpectedFault(operation);
            log.error("{} failed with unexpected fault", operation, e);
        }
        return Optional.empty();
    }
}

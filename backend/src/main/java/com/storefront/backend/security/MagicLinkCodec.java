package com.storefront.backend.security;

import com.storefront.backend.config.AuthProperties;
import com.storefront.backend.config.AuthSecrets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Stateless magic-link capability tokens.
 *
 * Format: {@code base64url(email) . issuedAtMillis . expiresAtMillis . hex(hmacSha256)}.
 * The HMAC covers the first three fields exactly as they appear in the token,
 * so changing any character of them invalidates the signature.
 */
@Slf4j
@Component
public class MagicLinkCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SEPARATOR = ".";
    private static final int PART_COUNT = 4;

    private final SecretKeySpec key;
    private final Duration lifetime;

    public MagicLinkCodec(AuthSecrets secrets, AuthProperties properties) {
        this.key = new SecretKeySpec(secrets.magicLink(), HMAC_ALGORITHM);
        this.lifetime = properties.getMagicLinkTtl();
    }

    public Duration lifetime() {
        return lifetime;
    }

    /**
     * Returns a signed token for {@code email}, or empty when the email is blank.
     */
    public Optional<String> issue(String email, Instant now) {
        if (email == null || email.isBlank()) {
            log.warn("Magic link not issued: empty email");
            return Optional.empty();
        }
        long issuedAt = now.toEpochMilli();
        long expiresAt = saturatedAdd(issuedAt, lifetime.toMillis());
        String encodedEmail = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(email.getBytes(StandardCharsets.UTF_8));
        String payload = encodedEmail + SEPARATOR + issuedAt + SEPARATOR + expiresAt;
        return Optional.of(payload + SEPARATOR + sign(payload));
    }

    /**
     * Returns the email bound into a valid, unexpired token, or empty.
     */
    public Optional<String> redeem(String token, Instant now) {
        if (token == null || token.isBlank()) {
            log.debug("Magic link rejected: empty token");
            return Optional.empty();
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != PART_COUNT) {
            log.warn("Magic link rejected: expected {} parts, got {}", PART_COUNT, parts.length);
            return Optional.empty();
        }
        String payload = parts[0] + SEPARATOR + parts[1] + SEPARATOR + parts[2];
        byte[] expected = sign(payload).getBytes(StandardCharsets.US_ASCII);
        byte[] supplied = parts[3].getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, supplied)) {
            log.warn("Magic link rejected: signature mismatch");
            return Optional.empty();
        }
        long issuedAt;
        long expiresAt;
        try {
            issuedAt = Long.parseLong(parts[1]);
            expiresAt = Long.parseLong(parts[2]);
        } catch (NumberFormatException e) {
            log.warn("Magic link rejected: non-numeric timestamp");
            return Optional.empty();
        }
        if (issuedAt > expiresAt) {
            log.warn("Magic link rejected: issued after its expiry");
            return Optional.empty();
        }
        if (now.toEpochMilli() > expiresAt) {
            log.debug("Magic link rejected: expired at {}", Instant.ofEpochMilli(expiresAt));
            return Optional.empty();
        }
        try {
            return Optional.of(new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.warn("Magic link rejected: undecodable email segment");
            return Optional.empty();
        }
    }

    private static long saturatedAdd(long issuedAt, long lifetimeMillis) {
        try {
            return Math.addExact(issuedAt, lifetimeMillis);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private String sign(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}

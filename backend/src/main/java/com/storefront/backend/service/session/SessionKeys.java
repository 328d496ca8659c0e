package com.storefront.backend.service.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache keys for issued tokens. Tokens are stored by SHA-256 digest, never verbatim.
 */
public final class SessionKeys {

    private static final String ACCESS_PREFIX = "session:access:";
    private static final String REFRESH_PREFIX = "session:refresh:";

    private SessionKeys() {
    }

    public static String access(String accessToken) {
        return ACCESS_PREFIX + hash(accessToken);
    }

    public static String refresh(String refreshToken) {
        return REFRESH_PREFIX + hash(refreshToken);
    }

    static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash session token", e);
        }
    }
}

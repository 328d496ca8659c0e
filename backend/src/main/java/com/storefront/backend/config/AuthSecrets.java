package com.storefront.backend.config;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * The three signing secrets, validated once at startup.
 *
 * Every secret must be present, at least 32 bytes long (the HS256 key
 * minimum) and different from the other two.
 */
@Slf4j
public final class AuthSecrets {

    static final int MIN_SECRET_BYTES = 32;

    private final byte[] access;
    private final byte[] refresh;
    private final byte[] magicLink;

    private AuthSecrets(byte[] access, byte[] refresh, byte[] magicLink) {
        this.access = access;
        this.refresh = refresh;
        this.magicLink = magicLink;
    }

    public static AuthSecrets from(AuthProperties.Secrets secrets) {
        return of(secrets.getAccess(), secrets.getRefresh(), secrets.getMagicLink());
    }

    public static AuthSecrets of(String access, String refresh, String magicLink) {
        byte[] accessBytes = require("storefront.auth.secrets.access (AUTH_ACCESS_SECRET)", access);
        byte[] refreshBytes = require("storefront.auth.secrets.refresh (AUTH_REFRESH_SECRET)", refresh);
        byte[] magicLinkBytes = require("storefront.auth.secrets.magic-link (AUTH_MAGIC_LINK_SECRET)", magicLink);
        if (access.equals(refresh) || access.equals(magicLink) || refresh.equals(magicLink)) {
            fail("Auth secrets must be distinct: access, refresh and magic-link secrets may not be shared");
        }
        return new AuthSecrets(accessBytes, refreshBytes, magicLinkBytes);
    }

    public byte[] access() {
        return access.clone();
    }

    public byte[] refresh() {
        return refresh.clone();
    }

    public byte[] magicLink() {
        return magicLink.clone();
    }

    private static byte[] require(String name, String value) {
        if (value == null || value.isBlank()) {
            fail("Missing auth secret " + name);
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            fail("Auth secret " + name + " must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return bytes;
    }

    private static void fail(String reason) {
        log.error(reason);
        throw new IllegalStateException(reason);
    }

    @Override
    public String toString() {
        return "AuthSecrets[redacted]";
    }
}

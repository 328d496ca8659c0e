package com.storefront.backend;

import com.storefront.backend.config.AuthProperties;
import com.storefront.backend.config.AuthSecrets;

public final class AuthTestFixtures {

    public static final String ACCESS_SECRET = "access-secret-for-tests-0123456789abcdef";
    public static final String REFRESH_SECRET = "refresh-secret-for-tests-0123456789abcdef";
    public static final String MAGIC_LINK_SECRET = "magic-link-secret-for-tests-0123456789ab";

    private AuthTestFixtures() {
    }

    public static AuthSecrets secrets() {
        return AuthSecrets.of(ACCESS_SECRET, REFRESH_SECRET, MAGIC_LINK_SECRET);
    }

    public static AuthProperties properties() {
        return new AuthProperties();
    }
}

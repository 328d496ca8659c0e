package com.storefront.backend.security;

/**
 * The two signed token classes. Each is signed with its own secret and
 * carries its kind in the {@code typ} claim.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}

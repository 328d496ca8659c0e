package com.storefront.backend.service;

/**
 * Expected domain failure inside the session authority. Never leaves it.
 */
class SessionAuthorityException extends RuntimeException {

    private final AuthFailureKind kind;

    SessionAuthorityException(AuthFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    AuthFailureKind getKind() {
        return kind;
    }
}

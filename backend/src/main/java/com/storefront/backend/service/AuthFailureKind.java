package com.storefront.backend.service;

/**
 * Why an authority operation failed. Callers only ever see "failed"; the
 * kind is for logs and metrics.
 */
public enum AuthFailureKind {
    INVALID_INPUT(false),
    AUTHENTICATION_FAILED(false),
    TOKEN_INVALID(false),
    SESSION_NOT_FOUND(false),
    UPSTREAM_UNAVAILABLE(true);

    private final boolean retryable;

    AuthFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}

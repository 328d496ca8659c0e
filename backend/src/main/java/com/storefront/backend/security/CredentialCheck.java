package com.storefront.backend.security;

/**
 * Outcome of checking a presented password against the stored hash.
 * {@code subjectId} is only meaningful when the outcome is {@link Outcome#VERIFIED}.
 */
public record CredentialCheck(Outcome outcome, long subjectId) {

    public enum Outcome {
        VERIFIED,
        NOT_FOUND,
        MISMATCH
    }

    public static CredentialCheck verified(long subjectId) {
        return new CredentialCheck(Outcome.VERIFIED, subjectId);
    }

    public static CredentialCheck notFound() {
        return new CredentialCheck(Outcome.NOT_FOUND, 0L);
    }

    public static CredentialCheck mismatch() {
        return new CredentialCheck(Outcome.MISMATCH, 0L);
    }

    public boolean isVerified() {
        return outcome == Outcome.VERIFIED;
    }
}

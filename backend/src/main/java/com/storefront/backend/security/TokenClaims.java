package com.storefront.backend.security;

import java.time.Instant;

public record TokenClaims(
        long subjectId,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt
) {
}

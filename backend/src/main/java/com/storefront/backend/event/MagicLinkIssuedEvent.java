package com.storefront.backend.event;

import java.time.Instant;

public record MagicLinkIssuedEvent(
        String email,
        String token,
        Instant expiresAt
) {

    @Override
    public String toString() {
        return "MagicLinkIssuedEvent[expiresAt=" + expiresAt + "]";
    }
}

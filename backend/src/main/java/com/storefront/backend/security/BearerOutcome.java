package com.storefront.backend.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * What {@link SessionAuthenticationFilter} made of the request's bearer token.
 * Stored as a request attribute for the entry point and the access log.
 */
public enum BearerOutcome {
    ABSENT,
    ACCEPTED,
    REJECTED;

    public static final String REQUEST_ATTRIBUTE = BearerOutcome.class.getName();

    public static BearerOutcome of(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        return value instanceof BearerOutcome outcome ? outcome : null;
    }
}

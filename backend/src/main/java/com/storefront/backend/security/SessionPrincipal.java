package com.storefront.backend.security;

public record SessionPrincipal(long subjectId) {
}

package com.storefront.backend.service;

public record SessionTokens(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "SessionTokens[redacted]";
    }
}

package com.storefront.backend.dto;

public record AccountIdentityResponse(long accountId) {
}

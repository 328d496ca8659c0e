package com.storefront.backend.dto;

public record SessionStatusResponse(boolean active) {
}

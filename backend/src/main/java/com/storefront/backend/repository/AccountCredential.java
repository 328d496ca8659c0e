package com.storefront.backend.repository;

public record AccountCredential(long id, String passwordHash) {

    @Override
    public String toString() {
        return "AccountCredential[id=" + id + ", passwordHash=redacted]";
    }
}

package com.storefront.backend.service.session;

/**
 * Value stored against a live token in the session cache.
 */
public record SessionRecord(long subjectId) {
}

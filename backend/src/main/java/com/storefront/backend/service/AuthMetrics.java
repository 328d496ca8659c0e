package com.storefront.backend.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class AuthMetrics {

    static final String OPERATIONS_COUNTER = "auth_operations_total";

    private final MeterRegistry meterRegistry;

    public void recordSuccess(String operation) {
        meterRegistry.counter(OPERATIONS_COUNTER, "operation", operation, "outcome", "success").increment();
    }

    public void recordFailure(String operation, AuthFailureKind kind) {
        meterRegistry.counter(OPERATIONS_COUNTER, "operation", operation,
                "outcome", kind.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordUnexpectedFault(String operation) {
        meterRegistry.counter(OPERATIONS_COUNTER, "operation", operation, "outcome", "unexpected").increment();
    }
}

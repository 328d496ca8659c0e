package com.storefront.backend.exception;

/**
 * I/O failure talking to the account store or the session cache.
 * The only failure a caller may reasonably retry.
 */
public class UpstreamUnavailableException extends RuntimeException {
    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.storefront.backend.exception;

public class SessionCacheUnavailableException extends UpstreamUnavailableException {
    public SessionCacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

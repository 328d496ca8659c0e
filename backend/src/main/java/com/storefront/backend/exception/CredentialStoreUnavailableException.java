package com.storefront.backend.exception;

public class CredentialStoreUnavailableException extends UpstreamUnavailableException {
    public CredentialStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

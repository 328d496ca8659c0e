package com.storefront.backend.security;

/**
 * Checks a presented secret for an identifier. Read-only.
 */
public interface CredentialVerifier {

    /**
     * @throws com.storefront.backend.exception.CredentialStoreUnavailableException if the account store cannot be reached
     */
    CredentialCheck verify(String identifier, String presentedSecret);
}

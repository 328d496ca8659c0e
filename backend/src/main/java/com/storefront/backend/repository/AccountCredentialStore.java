package com.storefront.backend.repository;

import java.util.Optional;

/**
 * Read-only view of the account store used for authentication.
 */
public interface AccountCredentialStore {

    /**
     * Find the credential for an identifier (email).
     * @param identifier the identifier
     * @return Optional containing the credential if an account exists
     * @throws com.storefront.backend.exception.CredentialStoreUnavailableException if the store cannot be reached
     */
    Optional<AccountCredential> findCredentialByIdentifier(String identifier);
}

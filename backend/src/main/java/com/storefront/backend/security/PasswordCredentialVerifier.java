package com.storefront.backend.security;

import com.storefront.backend.repository.AccountCredential;
import com.storefront.backend.repository.AccountCredentialStore;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Verifies passwords against salted bcrypt hashes from the account store.
 *
 * Unknown identifiers still pay for one hash comparison against a dummy
 * hash, so both failure outcomes take the same time.
 */
@Component
public class PasswordCredentialVerifier implements CredentialVerifier {

    private final AccountCredentialStore credentialStore;
    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordCredentialVerifier(AccountCredentialStore credentialStore, PasswordEncoder passwordEncoder) {
        this.credentialStore = credentialStore;
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    @Override
    public CredentialCheck verify(String identifier, String presentedSecret) {
        Optional<AccountCredential> credential = credentialStore.findCredentialByIdentifier(identifier);
        if (credential.isEmpty()) {
            passwordEncoder.matches(presentedSecret, dummyHash);
            return CredentialCheck.notFound();
        }
        AccountCredential account = credential.get();
        if (!passwordEncoder.matches(presentedSecret, account.passwordHash())) {
            return CredentialCheck.mismatch();
        }
        return CredentialCheck.verified(account.id());
    }
}

package com.storefront.backend.repository;

import com.storefront.backend.exception.CredentialStoreUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaAccountCredentialStore implements AccountCredentialStore {

    private final AccountRepository accountRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountCredential> findCredentialByIdentifier(String identifier) {
        try {
            return accountRepository.findByEmail(identifier)
                    .map(account -> new AccountCredential(account.getId(), account.getPasswordHash()));
        } catch (DataAccessException e) {
            throw new CredentialStoreUnavailableException("Account store lookup failed", e);
        }
    }
}

package com.storefront.backend.repository;

import com.storefront.backend.exception.CredentialStoreUnavailableException;
import com.storefront.backend.model.Account;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JpaAccountCredentialStoreTest {

    private final AccountRepository accountRepository = mock(AccountRepository.class);
    private final JpaAccountCredentialStore store = new JpaAccountCredentialStore(accountRepository);

    @Test
    void mapsAccountToCredential() {
        Account account = Account.builder().id(42L).email("shopper@example.com").passwordHash("$2a$04$hash").build();
        when(accountRepository.findByEmail("shopper@example.com")).thenReturn(Optional.of(account));

        Optional<AccountCredential> credential = store.findCredentialByIdentifier("shopper@example.com");

        assertThat(credential).contains(new AccountCredential(42L, "$2a$04$hash"));
        assertThat(credential.get().toString()).doesNotContain("$2a$04$hash");
    }

    @Test
    void unknownEmailIsEmpty() {
        when(accountRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThat(store.findCredentialByIdentifier("ghost@example.com")).isEmpty();
    }

    @Test
    void databaseFailureIsWrapped() {
        when(accountRepository.findByEmail("shopper@example.com"))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.findCredentialByIdentifier("shopper@example.com"))
                .isInstanceOf(CredentialStoreUnavailableException.class);
    }
}

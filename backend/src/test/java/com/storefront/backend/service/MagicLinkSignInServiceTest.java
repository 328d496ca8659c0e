package com.storefront.backend.service;

import com.storefront.backend.AuthTestFixtures;
import com.storefront.backend.MutableClock;
import com.storefront.backend.event.MagicLinkIssuedEvent;
import com.storefront.backend.exception.CredentialStoreUnavailableException;
import com.storefront.backend.repository.AccountCredential;
import com.storefront.backend.repository.AccountCredentialStore;
import com.storefront.backend.security.CredentialVerifier;
import com.storefront.backend.security.MagicLinkCodec;
import com.storefront.backend.security.SignedTokenCodec;
import com.storefront.backend.service.session.InMemorySessionCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MagicLinkSignInServiceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final String EMAIL = "shopper@example.com";

    private final MutableClock clock = new MutableClock(T0);
    private final AccountCredentialStore store = mock(AccountCredentialStore.class);
    private final ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);
    private final MagicLinkCodec magicLinkCodec =
            new MagicLinkCodec(AuthTestFixtures.secrets(), AuthTestFixtures.properties());

    private SessionAuthority authority;
    private MagicLinkSignInService service;

    @BeforeEach
    void setUp() {
        SignedTokenCodec tokenCodec = new SignedTokenCodec(AuthTestFixtures.secrets(), AuthTestFixtures.properties());
        authority = new SessionAuthority(mock(CredentialVerifier.class), tokenCodec, magicLinkCodec,
                new InMemorySessionCache(clock), new AuthMetrics(new SimpleMeterRegistry()), clock);
        service = new MagicLinkSignInService(authority, store, magicLinkCodec, eventPublisher, clock);
    }

    @Test
    void requestPublishesLinkForDelivery() {
        assertThat(service.requestLink(EMAIL)).isTrue();

        ArgumentCaptor<MagicLinkIssuedEvent> captor = ArgumentCaptor.forClass(MagicLinkIssuedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        MagicLinkIssuedEvent event = captor.getValue();
        assertThat(event.email()).isEqualTo(EMAIL);
        assertThat(event.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
        assertThat(event.toString()).doesNotContain(event.token());
    }

    @Test
    void emptyEmailPublishesNothing() {
        assertThat(service.requestLink("")).isFalse();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void redeemedLinkSignsInTheOwningAccount() {
        when(store.findCredentialByIdentifier(EMAIL)).thenReturn(Optional.of(new AccountCredential(42L, "hash")));
        String link = magicLinkCodec.issue(EMAIL, T0).orElseThrow();

        SessionTokens tokens = service.signIn(link).orElseThrow();

        assertThat(authority.verifySession(tokens.accessToken())).isTrue();
    }

    @Test
    void linkForUnknownAccountDoesNotSignIn() {
        when(store.findCredentialByIdentifier(EMAIL)).thenReturn(Optional.empty());
        String link = magicLinkCodec.issue(EMAIL, T0).orElseThrow();

        assertThat(service.signIn(link)).isEmpty();
    }

    @Test
    void expiredLinkDoesNotSignIn() {
        String link = magicLinkCodec.issue(EMAIL, T0).orElseThrow();
        clock.advance(Duration.ofMinutes(16));

        assertThat(service.signIn(link)).isEmpty();
        verify(store, never()).findCredentialByIdentifier(EMAIL);
    }

    @Test
    void storeOutageDoesNotSignIn() {
        when(store.findCredentialByIdentifier(EMAIL))
                .thenThrow(new CredentialStoreUnavailableException("down", new RuntimeException("timeout")));
        String link = magicLinkCodec.issue(EMAIL, T0).orElseThrow();

        assertThat(service.signIn(link)).isEmpty();
    }
}

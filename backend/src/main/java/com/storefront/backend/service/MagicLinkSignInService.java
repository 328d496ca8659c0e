package com.storefront.backend.service;

import com.storefront.backend.event.MagicLinkIssuedEvent;
import com.storefront.backend.exception.UpstreamUnavailableException;
import com.storefront.backend.repository.AccountCredential;
import com.storefront.backend.repository.AccountCredentialStore;
import com.storefront.backend.security.MagicLinkCodec;
import com.storefront.backend.util.LogRedaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Password-less sign-in: issues magic links and turns a redeemed link into
 * a normal session for the account that owns the email.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MagicLinkSignInService {

    private final SessionAuthority sessionAuthority;
    private final AccountCredentialStore credentialStore;
    private final MagicLinkCodec magicLinkCodec;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Issues a link and publishes it for delivery. Returns false only when
     * no link could be issued.
     */
    public boolean requestLink(String email) {
        Optional<String> token = sessionAuthority.issueMagicLink(email);
        token.ifPresent(value -> eventPublisher.publishEvent(
                new MagicLinkIssuedEvent(email, value, clock.instant().plus(magicLinkCodec.lifetime()))));
        return token.isPresent();
    }

    public Optional<SessionTokens> signIn(String magicLinkToken) {
        return sessionAuthority.redeemMagicLink(magicLinkToken)
                .flatMap(this::findAccount)
                .flatMap(account -> sessionAuthority.createSession(account.id()));
    }

    private Optional<AccountCredential> findAccount(String email) {
        try {
            Optional<AccountCredential> account = credentialStore.findCredentialByIdentifier(email);
            if (account.isEmpty()) {
                log.warn("Magic link redeemed for unknown account {}", LogRedaction.maskEmail(email));
            }
            return account;
        } catch (UpstreamUnavailableException e) {
            log.error("Magic link sign-in failed kind={} retryable=true reason={}",
                    AuthFailureKind.UPSTREAM_UNAVAILABLE, e.getMessage(), e);
            return Optional.empty();
        }
    }
}

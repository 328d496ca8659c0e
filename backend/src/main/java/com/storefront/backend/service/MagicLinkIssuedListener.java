package com.storefront.backend.service;

import com.storefront.backend.event.MagicLinkIssuedEvent;
import com.storefront.backend.util.LogRedaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Hand-off point for magic-link delivery. Outbound email is owned by the
 * email service; this side only records that a link is ready to send.
 */
@Component
@Slf4j
public class MagicLinkIssuedListener {

    @EventListener(MagicLinkIssuedEvent.class)
    public void onMagicLinkIssued(MagicLinkIssuedEvent event) {
        log.info("Magic link ready for delivery to={} expiresAt={}",
                LogRedaction.maskEmail(event.email()), event.expiresAt());
    }
}

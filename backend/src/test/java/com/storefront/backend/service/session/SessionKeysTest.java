package com.storefront.backend.service.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionKeysTest {

    @Test
    void keysHoldTheTokenDigestNotTheToken() {
        String token = "eyJhbGciOiJIUzI1NiJ9.payload.signature";

        assertThat(SessionKeys.access(token))
                .startsWith("session:access:")
                .doesNotContain(token)
                .hasSize("session:access:".length() + 64);
        assertThat(SessionKeys.refresh(token)).startsWith("session:refresh:").endsWith(SessionKeys.hash(token));
    }

    @Test
    void accessAndRefreshNamespacesDoNotCollide() {
        assertThat(SessionKeys.access("t")).isNotEqualTo(SessionKeys.refresh("t"));
    }
}

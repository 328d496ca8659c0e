package com.storefront.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "storefront.auth")
@Data
@Validated
public class AuthProperties {

    private Secrets secrets = new Secrets();

    @NotNull
    private Duration accessTokenTtl = Duration.ofMinutes(15);

    @NotNull
    private Duration refreshTokenTtl = Duration.ofDays(7);

    @NotNull
    private Duration magicLinkTtl = Duration.ofMinutes(15);

    private Cache cache = new Cache();
    private Password password = new Password();

    /**
     * Signing secrets, one per role. Bound from the environment only.
     */
    @Data
    public static class Secrets {
        private String access;
        private String refresh;
        private String magicLink;
    }

    @Data
    public static class Cache {
        private CacheType type = CacheType.REDIS;
        private String keyPrefix = "storefront:";
    }

    @Data
    public static class Password {
        @Min(4)
        @Max(31)
        private int bcryptStrength = 10;
    }

    public enum CacheType {
        REDIS,
        MEMORY
    }
}

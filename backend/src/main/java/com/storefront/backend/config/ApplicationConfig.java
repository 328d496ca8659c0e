package com.storefront.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Application Configuration
 * Core beans shared by the session authority and the web layer
 */
@Configuration
@RequiredArgsConstructor
public class ApplicationConfig {

    private final AuthProperties authProperties;

    @Bean
    public AuthSecrets authSecrets() {
        return AuthSecrets.from(authProperties.getSecrets());
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(authProperties.getPassword().getBcryptStrength());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

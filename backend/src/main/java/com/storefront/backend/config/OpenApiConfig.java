package com.storefront.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API docs. Sign-in routes are public; account routes take the access token
 * from {@code /api/auth/login} as a bearer credential.
 */
@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI storefrontAuthOpenApi(AuthProperties authProperties) {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token, valid for " + authProperties.getAccessTokenTtl().toMinutes()
                        + " minutes unless revoked by logout");
        return new OpenAPI()
                .info(new Info()
                        .title("Storefront Auth API")
                        .description("Login, session verification, refresh, logout and magic-link sign-in")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, bearerScheme));
    }

    @Bean
    public GroupedOpenApi signInApi() {
        return GroupedOpenApi.builder()
                .group("sign-in")
                .pathsToMatch("/api/auth/**")
                .build();
    }

    @Bean
    public GroupedOpenApi accountApi() {
        return GroupedOpenApi.builder()
                .group("account")
                .pathsToMatch("/api/account/**")
                .build();
    }
}

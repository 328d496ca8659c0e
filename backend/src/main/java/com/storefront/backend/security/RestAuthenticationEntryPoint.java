package com.storefront.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.backend.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * 401 for protected routes. A missing bearer token and a token without a
 * live session get different messages and {@code WWW-Authenticate} challenges
 * (RFC 6750); why a token was rejected is never disclosed.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String TOKEN_REQUIRED = "Bearer token required";
    static final String SESSION_INACTIVE = "Session expired or revoked";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        boolean rejected = BearerOutcome.of(request) == BearerOutcome.REJECTED;
        String challenge = rejected ? "Bearer error=\"invalid_token\"" : "Bearer";
        ApiError error = ApiError.of(HttpStatus.UNAUTHORIZED, rejected ? SESSION_INACTIVE : TOKEN_REQUIRED,
                request.getRequestURI(), List.of());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, challenge);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}

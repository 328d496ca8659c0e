package com.storefront.backend.controller;

import com.storefront.backend.dto.AccessTokenResponse;
import com.storefront.backend.dto.LoginRequest;
import com.storefront.backend.dto.LogoutRequest;
import com.storefront.backend.dto.MagicLinkRedeemRequest;
import com.storefront.backend.dto.MagicLinkRequest;
import com.storefront.backend.dto.RefreshRequest;
import com.storefront.backend.dto.SessionStatusResponse;
import com.storefront.backend.dto.SessionTokensResponse;
import com.storefront.backend.exception.NotFoundException;
import com.storefront.backend.exception.UnauthorizedException;
import com.storefront.backend.security.SessionAuthenticationFilter;
import com.storefront.backend.security.SignedTokenCodec;
import com.storefront.backend.security.TokenKind;
import com.storefront.backend.service.MagicLinkSignInService;
import com.storefront.backend.service.SessionAuthority;
import com.storefront.backend.service.SessionTokens;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication Controller
 * HTTP surface of the session authority
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Auth")
public class AuthController {

    private static final String BAD_CREDENTIALS = "Bad credentials";

    private final SessionAuthority sessionAuthority;
    private final MagicLinkSignInService magicLinkSignInService;
    private final SignedTokenCodec tokenCodec;

    @PostMapping("/login")
    @Operation(summary = "Exchange email and password for an access and refresh token")
    public ResponseEntity<SessionTokensResponse> login(@Valid @RequestBody LoginRequest request) {
        return sessionAuthority.login(request.getEmail(), request.getPassword())
                .map(tokens -> ResponseEntity.ok(toResponse(tokens)))
                .orElseThrow(() -> new UnauthorizedException(BAD_CREDENTIALS));
    }

    @GetMapping("/session")
    @Operation(summary = "Check whether the bearer access token is a live session")
    public ResponseEntity<SessionStatusResponse> verify(@RequestHeader("Authorization") String authorization) {
        String token = SessionAuthenticationFilter.stripBearer(authorization);
        if (!sessionAuthority.verifySession(token)) {
            throw new UnauthorizedException("Session missing, expired or revoked");
        }
        return ResponseEntity.ok(new SessionStatusResponse(true));
    }

    @PostMapping("/logout")
    @Operation(summary = "Revoke the bearer access token and, optionally, a refresh token")
    public ResponseEntity<Void> logout(@RequestHeader("Authorization") String authorization,
                                       @RequestBody(required = false) LogoutRequest request) {
        String token = SessionAuthenticationFilter.stripBearer(authorization);
        if (!sessionAuthority.deleteSession(token)) {
            throw new NotFoundException("Session not found");
        }
        // only a caller that proved a live session may drop the refresh token
        if (request != null && request.getRefreshToken() != null && !request.getRefreshToken().isBlank()
                && !sessionAuthority.revokeRefreshToken(request.getRefreshToken())) {
            log.info("Logout: refresh token was already used, expired or revoked");
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/refresh")
    @Operation(summary = "Exchange a refresh token, once, for a new access token")
    public ResponseEntity<AccessTokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return sessionAuthority.refreshSession(request.getRefreshToken())
                .map(accessToken -> ResponseEntity.ok(AccessTokenResponse.builder()
                        .accessToken(accessToken)
                        .expiresIn(tokenCodec.lifetime(TokenKind.ACCESS).toSeconds())
                        .build()))
                .orElseThrow(() -> new UnauthorizedException("Refresh token invalid, expired or already used"));
    }

    @PostMapping("/magic-link")
    @Operation(summary = "Send a sign-in link to an email address")
    public ResponseEntity<Void> requestMagicLink(@Valid @RequestBody MagicLinkRequest request) {
        if (!magicLinkSignInService.requestLink(request.getEmail())) {
            log.warn("Magic link request could not be served");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }

    @PostMapping("/magic-link/redeem")
    @Operation(summary = "Exchange a magic link for an access and refresh token")
    public ResponseEntity<SessionTokensResponse> redeemMagicLink(@Valid @RequestBody MagicLinkRedeemRequest request) {
        return magicLinkSignInService.signIn(request.getToken())
                .map(tokens -> ResponseEntity.ok(toResponse(tokens)))
                .orElseThrow(() -> new UnauthorizedException("Magic link invalid or expired"));
    }

    private SessionTokensResponse toResponse(SessionTokens tokens) {
        return SessionTokensResponse.builder()
                .accessToken(tokens.accessToken())
                .refreshToken(tokens.refreshToken())
                .expiresIn(tokenCodec.lifetime(TokenKind.ACCESS).toSeconds())
                .build();
    }
}

package com.storefront.backend.controller;

import com.storefront.backend.dto.AccountIdentityResponse;
import com.storefront.backend.exception.UnauthorizedException;
import com.storefront.backend.security.SessionPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/account")
@Tag(name = "Account")
@SecurityRequirement(name = "bearerAuth")
public class AccountController {

    @GetMapping("/me")
    @Operation(summary = "Account id of the current session")
    public ResponseEntity<AccountIdentityResponse> me(@AuthenticationPrincipal SessionPrincipal principal) {
        if (principal == null) {
            throw new UnauthorizedException("Unauthorized");
        }
        return ResponseEntity.ok(new AccountIdentityResponse(principal.subjectId()));
    }
}

package com.storefront.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional logout body. When a refresh token is given it is revoked too.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogoutRequest {

    @Schema(accessMode = Schema.AccessMode.WRITE_ONLY)
    private String refreshToken;
}

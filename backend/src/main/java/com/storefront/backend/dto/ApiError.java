package com.storefront.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every non-2xx answer. Carries the request and correlation
 * ids of the failing request so a client report can be matched to the logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {

    private Instant timestamp;
    private String path;
    private int status;
    private String error;
    private String message;
    private String requestId;
    private String correlationId;
    private List<ApiErrorDetail> details;

    public static ApiError of(HttpStatus status, String message, String path, List<ApiErrorDetail> details) {
        return ApiError.builder()
                .timestamp(Instant.now())
                .path(path)
                .status(status.value())
                .error(status.name())
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .details(details)
                .build();
    }
}

package com.storefront.backend.config;

import com.storefront.backend.security.BearerOutcome;
import com.storefront.backend.security.SessionPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;

/**
 * One access-log line per request with the bearer outcome and, when a
 * session was accepted, its subject. Query strings are left out since they
 * may carry magic-link tokens. Health probes are logged at debug.
 */
@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final String HEALTH_PATH = "/actuator/health";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            String line = describe(request, response.getStatus(), durationMs);
            if (request.getRequestURI().startsWith(HEALTH_PATH)) {
                log.debug(line);
            } else {
                log.info(line);
            }
        }
    }

    static String describe(HttpServletRequest request, int status, long durationMs) {
        return "HTTP " + request.getMethod() + " " + request.getRequestURI() + " -> " + status
                + " (" + durationMs + " ms) auth=" + authOutcome(request) + " subject=" + subject()
                + " client=" + request.getRemoteAddr();
    }

    private static String authOutcome(HttpServletRequest request) {
        BearerOutcome outcome = BearerOutcome.of(request);
        return outcome == null ? "public" : outcome.name().toLowerCase(Locale.ROOT);
    }

    private static String subject() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof SessionPrincipal principal) {
            return Long.toString(principal.subjectId());
        }
        return "-";
    }
}

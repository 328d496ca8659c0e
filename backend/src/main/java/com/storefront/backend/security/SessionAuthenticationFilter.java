package com.storefront.backend.security;

import com.storefront.backend.service.SessionAuthority;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * Session Authentication Filter
 * Authenticates requests whose bearer token is a live access session
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionAuthority sessionAuthority;
    private final SignedTokenCodec tokenCodec;
    private final Clock clock;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> publicPaths = List.of(
            "/actuator/health",
            "/actuator/health/**",
            "/v3/api-docs",
            "/v3/api-docs/**",
            "/swagger-ui.html",
            "/swagger-ui/**",
            "/api/auth/**"
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = bearerToken(request);
        BearerOutcome outcome = BearerOutcome.ABSENT;
        if (token != null && sessionAuthority.verifySession(token)) {
            // verifySession only answers yes/no; the subject comes from the token itself
            outcome = tokenCodec.parse(token, TokenKind.ACCESS, clock.instant())
                    .map(claims -> {
                        authenticate(request, claims.subjectId());
                        return BearerOutcome.ACCEPTED;
                    })
                    .orElse(BearerOutcome.REJECTED);
        } else if (token != null) {
            outcome = BearerOutcome.REJECTED;
        }
        request.setAttribute(BearerOutcome.REQUEST_ATTRIBUTE, outcome);
        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, long subjectId) {
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                new SessionPrincipal(subjectId), null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated subject {}", subjectId);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return publicPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    public static String bearerToken(HttpServletRequest request) {
        return stripBearer(request.getHeader("Authorization"));
    }

    public static String stripBearer(String header) {
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}

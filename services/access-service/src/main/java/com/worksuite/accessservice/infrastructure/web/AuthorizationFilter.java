package com.worksuite.accessservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksuite.observability.AccessMetrics;
import com.worksuite.observability.CorrelationContextHolder;
import com.worksuite.security.AuthenticationResult;
import com.worksuite.security.AuthorizationContext;
import com.worksuite.security.AuthorizationEngine;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates every {@code /api/**} request and stores the resulting {@link
 * AuthorizationContext} as a request attribute.
 * <p>
 * Authentication failures end the request here with a 401 problem body, storage failures with a
 * 503; handlers therefore only ever see authenticated callers. The caller's user and workspace ids are added to the logging
 * context once known.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthorizationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationFilter.class);

    /** Request attribute holding the {@link AuthorizationContext}. */
    public static final String CONTEXT_ATTRIBUTE = "com.worksuite.security.AuthorizationContext";

    static final String PROTECTED_PREFIX = "/api/";

    private final AuthorizationEngine engine;
    private final AccessMetrics metrics;
    private final ObjectMapper objectMapper;

    public AuthorizationFilter(
            AuthorizationEngine engine, AccessMetrics metrics, ObjectMapper objectMapper) {
        this.engine = engine;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(PROTECTED_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        AuthenticationResult result;
        try {
            result = metrics.timeResolution(() -> engine.authenticateHeader(header));
        } catch (DataAccessException e) {
            log.error(
                    "Storage failure while authenticating {} {}",
                    request.getMethod(),
                    request.getRequestURI(),
                    e);
            writeProblem(response, ProblemResponses.storageUnavailable());
            return;
        }

        if (!result.authenticated()) {
            log.info(
                    "Rejected {} {}: {}",
                    request.getMethod(),
                    request.getRequestURI(),
                    result.failure().value());
            metrics.authenticationFailed(result.failure().value());
            writeProblem(response, ProblemResponses.forFailure(result.failure(), result.message()));
            return;
        }

        AuthorizationContext context = result.context();
        metrics.authenticated();
        CorrelationContextHolder.bindPrincipal(
                Long.toString(context.userId()),
                context.workspaceId() == null ? null : context.workspaceId().toString());
        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        filterChain.doFilter(request, response);
    }

    private void writeProblem(HttpServletResponse response, ProblemDetail problem) throws IOException {
        response.setStatus(problem.getStatus());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ProblemResponses.asMap(problem));
    }
}

package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.observability.CorrelationContextHolder;
import com.worksuite.security.FailureCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds RFC 7807 bodies for engine failures.
 * <p>
 * Each body carries the failure code's wire value under {@code code}, so clients branch on
 * {@code trial_expired} or {@code cyclic_dependency} rather than on the message.
 */
public final class ProblemResponses {

    static final String ERROR_TYPE_BASE = "https://worksuite.dev/errors/";

    private ProblemResponses() {
        // utility class
    }

    /** HTTP status for a failure code, derived from its kind. */
    public static HttpStatus statusFor(FailureCode code) {
        if (code == FailureCode.INVALID_LINK) {
            return HttpStatus.BAD_REQUEST;
        }
        return switch (code.kind()) {
            case UNAUTHENTICATED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RESOURCE_GONE -> HttpStatus.GONE;
            case GRAPH_CONFLICT -> HttpStatus.CONFLICT;
            case DATA_INTEGRITY_WARNING -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static ProblemDetail forFailure(FailureCode code, String detail) {
        HttpStatus status = statusFor(code);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + code.value().replace('_', '-')));
        problem.setProperty("code", code.value());
        enrich(problem);
        return problem;
    }

    /** 503 body for storage failures, the only failures a client may retry. */
    public static ProblemDetail storageUnavailable() {
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.SERVICE_UNAVAILABLE, "Storage is temporarily unavailable");
        problem.setTitle("Service Unavailable");
        problem.setType(URI.create(ERROR_TYPE_BASE + "storage"));
        enrich(problem);
        return problem;
    }

    /** Adds the timestamp and, when one is bound, the correlation id. */
    public static void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        String correlationId = CorrelationContextHolder.currentCorrelationId();
        if (correlationId != null) {
            problem.setProperty("correlationId", correlationId);
        }
    }

    /** Flat JSON view of a problem, for writers that bypass Spring MVC message conversion. */
    static Map<String, Object> asMap(ProblemDetail problem) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", problem.getType().toString());
        body.put("title", problem.getTitle());
        body.put("status", problem.getStatus());
        body.put("detail", problem.getDetail());
        if (problem.getProperties() != null) {
            body.putAll(problem.getProperties());
        }
        return body;
    }
}

package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.observability.AccessMetrics;
import com.worksuite.security.AccessDecision;
import com.worksuite.security.FailureCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Maps engine denials and request errors to RFC 7807 {@link ProblemDetail} responses.
 * <p>
 * Denials use the status of their failure kind: 403 forbidden, 404 not found, 410 gone. Rejected
 * links are 409, or 400 for a link that can never be valid. Storage failures are 503, the only
 * status a caller may retry.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final AccessMetrics metrics;

    public GlobalExceptionHandler(AccessMetrics metrics) {
        this.metrics = metrics;
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDenied(AccessDeniedException ex) {
        AccessDecision decision = ex.decision();
        log.info("Access denied: {}", decision.reason().value());
        metrics.accessDenied(decision.reason().value());
        ProblemDetail problem = ProblemResponses.forFailure(decision.reason(), decision.message());
        if (decision.trialEndsAt() != null) {
            problem.setProperty("trialEndsAt", decision.trialEndsAt().toString());
        }
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    @ExceptionHandler(LinkRejectedException.class)
    public ResponseEntity<ProblemDetail> handleLinkRejected(LinkRejectedException ex) {
        FailureCode reason = ex.validation().reason();
        log.info("Link rejected: {}", reason.value());
        metrics.linkRejected(reason.value());
        ProblemDetail problem = ProblemResponses.forFailure(reason, ex.validation().message());
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ProblemResponses.ERROR_TYPE_BASE + "bad-request"));
        ProblemResponses.enrich(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ProblemResponses.ERROR_TYPE_BASE + "validation"));
        ProblemResponses.enrich(problem);
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Malformed request body");
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ProblemResponses.ERROR_TYPE_BASE + "bad-request"));
        ProblemResponses.enrich(problem);
        return problem;
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStorage(DataAccessException ex) {
        log.error("Storage failure", ex);
        return ProblemResponses.storageUnavailable();
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ProblemResponses.ERROR_TYPE_BASE + "internal"));
        ProblemResponses.enrich(problem);
        return problem;
    }
}

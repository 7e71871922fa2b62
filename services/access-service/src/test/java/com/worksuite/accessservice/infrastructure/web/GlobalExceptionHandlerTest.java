package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.observability.AccessMetrics;
import com.worksuite.security.AccessDecision;
import com.worksuite.security.FailureCode;
import com.worksuite.workgraph.LinkValidationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GlobalExceptionHandler handler =
            new GlobalExceptionHandler(new AccessMetrics(registry, "access-test"));

    @Nested
    @DisplayName("access denials")
    class Denials {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "PERMISSION_REQUIRED, 403",
            "WORKSPACE_ACCESS_DENIED, 403",
            "WORKSPACE_NOT_FOUND, 404",
            "PROJECT_UNAVAILABLE, 410"
        })
        @DisplayName("status follows the failure kind")
        void statusByKind(FailureCode code, int status) {
            ResponseEntity<ProblemDetail> response =
                    handler.handleAccessDenied(new AccessDeniedException(AccessDecision.deny(code)));

            assertThat(response.getStatusCode().value()).isEqualTo(status);
            assertThat(response.getBody().getProperties()).containsEntry("code", code.value());
        }

        @Test
        @DisplayName("an expired trial carries its end date")
        void trialExpired() {
            Instant trialEnd = Instant.parse("2024-03-01T00:00:00Z");

            ResponseEntity<ProblemDetail> response =
                    handler.handleAccessDenied(new AccessDeniedException(AccessDecision.trialExpired(trialEnd)));

            assertThat(response.getStatusCode().value()).isEqualTo(403);
            assertThat(response.getBody().getProperties())
                    .containsEntry("code", "trial_expired")
                    .containsEntry("trialEndsAt", "2024-03-01T00:00:00Z");
        }

        @Test
        @DisplayName("denials are counted by reason")
        void countsDenials() {
            handler.handleAccessDenied(
                    new AccessDeniedException(AccessDecision.deny(FailureCode.PERMISSION_REQUIRED)));

            assertThat(
                            registry.get("worksuite.access.denials")
                                    .tag("reason", "permission_required")
                                    .counter()
                                    .count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("an allowed decision cannot be raised")
        void allowedDecisionRejected() {
            assertThatThrownBy(() -> new AccessDeniedException(AccessDecision.allow()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("link rejections")
    class Links {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "CYCLIC_DEPENDENCY, 409",
            "DUPLICATE_LINK, 409",
            "INVALID_LINK, 400",
            "TASK_NOT_FOUND, 404"
        })
        @DisplayName("status follows the rejection reason")
        void statusByReason(FailureCode code, int status) {
            ResponseEntity<ProblemDetail> response =
                    handler.handleLinkRejected(new LinkRejectedException(LinkValidationResult.reject(code)));

            assertThat(response.getStatusCode().value()).isEqualTo(status);
            assertThat(response.getBody().getDetail()).isEqualTo(code.defaultMessage());
        }
    }

    @Test
    @DisplayName("storage failures are 503")
    void storageFailure() {
        ProblemDetail result = handler.handleStorage(new DataAccessResourceFailureException("down"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getProperties()).containsKey("timestamp");
    }

    @Test
    @DisplayName("IllegalArgumentException is 400")
    void illegalArgument() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("Unknown link type: x"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("Unknown link type: x");
    }

    @Test
    @DisplayName("anything else is 500 without leaking the message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("secret detail"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("secret detail");
    }
}

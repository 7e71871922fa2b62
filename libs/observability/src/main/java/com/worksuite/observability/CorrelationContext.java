package com.worksuite.observability;

/**
 * Identifiers that tie the log lines and metrics of one request together.
 * <p>
 * Established by the correlation filter at the start of a request, enriched with the caller once
 * authentication succeeds, and copied into the SLF4J MDC by {@link CorrelationContextHolder}.
 *
 * @param correlationId business-flow id, propagated in the {@code X-Correlation-ID} header
 * @param tenantId resolved workspace id (nullable until authentication, or for super-admins)
 * @param userId authenticated user id (nullable until authentication)
 * @param requestId id of this single request
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Request-level context before the caller is known. */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId);
    }

    /** Copy with the authenticated caller filled in. */
    public CorrelationContext withPrincipal(String userId, String tenantId) {
        return new CorrelationContext(correlationId, tenantId, userId, requestId);
    }
}

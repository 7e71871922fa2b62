package com.worksuite.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Micrometer meters for the access control engine.
 * <p>
 * Every meter carries a {@code service} tag; outcome meters add a {@code reason} tag holding the
 * failure code's wire value, so dashboards can split e.g. {@code trial_expired} from
 * {@code permission_required}.
 */
public final class AccessMetrics {

    public static final String TAG_SERVICE = "service";
    public static final String TAG_REASON = "reason";

    static final String AUTHENTICATIONS = "worksuite.access.authentications";
    static final String AUTHENTICATION_FAILURES = "worksuite.access.authentication.failures";
    static final String DENIALS = "worksuite.access.denials";
    static final String LINK_REJECTIONS = "worksuite.workgraph.link.rejections";
    static final String TOKENS_ISSUED = "worksuite.access.tokens.issued";
    static final String CONTEXT_RESOLUTION = "worksuite.access.context.resolution";

    private final MeterRegistry registry;
    private final String serviceName;
    private final Timer resolutionTimer;

    public AccessMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        this.resolutionTimer = Timer.builder(CONTEXT_RESOLUTION)
                .description("Time to build the authorization context of a request")
                .tags(baseTags())
                .register(registry);
    }

    public void authenticated() {
        counter(AUTHENTICATIONS, "Requests authenticated successfully").increment();
    }

    public void authenticationFailed(String reason) {
        counter(AUTHENTICATION_FAILURES, "Requests rejected as unauthenticated", TAG_REASON, reason).increment();
    }

    public void accessDenied(String reason) {
        counter(DENIALS, "Access checks that denied the request", TAG_REASON, reason).increment();
    }

    public void linkRejected(String reason) {
        counter(LINK_REJECTIONS, "Work-item links rejected by graph validation", TAG_REASON, reason).increment();
    }

    public void tokenIssued() {
        counter(TOKENS_ISSUED, "Bearer credentials issued").increment();
    }

    /** Times building the authorization context. */
    public <T> T timeResolution(Supplier<T> work) {
        return resolutionTimer.record(work);
    }

    private Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags().and(tags))
                .register(registry);
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}

package com.worksuite.accessservice.infrastructure.web;

import com.worksuite.observability.CorrelationContext;
import com.worksuite.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation id when none is sent")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("echoes the caller's correlation id")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "corr-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("corr-123");
    }

    @Test
    @DisplayName("context and MDC are populated while the chain runs")
    void populatesContextDuringChain() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var mdcValue = new AtomicReference<String>();
        FilterChain chain =
                (req, resp) -> {
                    captured.set(CorrelationContextHolder.get().orElse(null));
                    mdcValue.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
                };
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(captured.get().correlationId()).isEqualTo("during-chain");
        assertThat(captured.get().requestId()).isNotBlank();
        assertThat(captured.get().userId()).isNull();
        assertThat(mdcValue.get()).isEqualTo("during-chain");
    }

    @Test
    @DisplayName("context is cleared after the request, even when the chain throws")
    void clearsContext() {
        FilterChain failing =
                (req, resp) -> {
                    throw new IllegalStateException("boom");
                };

        assertThatThrownBy(
                        () ->
                                filter.doFilter(
                                        new MockHttpServletRequest(),
                                        new MockHttpServletResponse(),
                                        failing))
                .hasMessage("boom");

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }
}

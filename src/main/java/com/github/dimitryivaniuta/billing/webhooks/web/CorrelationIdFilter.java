package com.github.dimitryivaniuta.billing.webhooks.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the webhook request id into the MDC and echoes it back to the caller.
 *
 * <p>The id is taken from {@code X-Correlation-Id}, then {@code X-Request-Id}. Values that are not short
 * tokens are replaced by a random UUID; the id ends up in log lines and in the {@code request_id} column of
 * the audit table.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /** MDC key, referenced by the logging pattern. */
    public static final String MDC_KEY = "correlationId";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = requestIdOf(request);
        MDC.put(MDC_KEY, requestId);
        response.setHeader(CORRELATION_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String requestIdOf(HttpServletRequest request) {
        return Stream.of(CORRELATION_ID_HEADER, REQUEST_ID_HEADER)
                .map(request::getHeader)
                .filter(v -> v != null && ACCEPTED.matcher(v.trim()).matches())
                .map(String::trim)
                .findFirst()
                .orElseGet(() -> UUID.randomUUID().toString());
    }
}

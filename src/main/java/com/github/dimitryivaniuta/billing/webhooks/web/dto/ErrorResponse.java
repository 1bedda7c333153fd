package com.github.dimitryivaniuta.billing.webhooks.web.dto;

import java.time.Instant;

/**
 * Error body for non-webhook endpoints. Webhook endpoints answer with
 * {@link com.github.dimitryivaniuta.billing.webhooks.service.dto.WebhookResult} instead.
 *
 * <p>{@code requestId} matches the {@code X-Correlation-Id} response header so a caller can quote it.</p>
 */
public record ErrorResponse(String code, String message, String path, String requestId, Instant timestamp) {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    /**
     * Generic failure; exception text is logged, never returned.
     */
    public static ErrorResponse internal(String path, String requestId, Instant timestamp) {
        return new ErrorResponse(INTERNAL_ERROR, "Unexpected error", path, requestId, timestamp);
    }
}

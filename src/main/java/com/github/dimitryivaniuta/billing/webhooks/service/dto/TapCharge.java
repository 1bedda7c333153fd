package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Charge as returned by Tap's {@code GET /v2/charges/{id}}. This is the only source of truth for status,
 * amount and currency.
 *
 * @param id        charge id
 * @param status    gateway status, e.g. {@code CAPTURED}
 * @param amount    charged amount
 * @param currency  ISO currency code
 * @param reference gateway and payment references
 * @param metadata  merchant metadata set when the charge was created ({@code user_id}, {@code service_id}, ...)
 * @param response  gateway response code and message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TapCharge(
        String id,
        String status,
        BigDecimal amount,
        String currency,
        Reference reference,
        Map<String, Object> metadata,
        Response response
) {

    public static final String CAPTURED = "CAPTURED";
    public static final String FAILED = "FAILED";
    public static final String DECLINED = "DECLINED";
    public static final String CANCELLED = "CANCELLED";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Reference(String gateway, String payment) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(String code, String message) {}

    public boolean isCaptured() {
        return CAPTURED.equals(status);
    }

    public boolean isFailure() {
        return FAILED.equals(status) || DECLINED.equals(status) || CANCELLED.equals(status);
    }

    /**
     * Reads a metadata entry as a string.
     *
     * @param key metadata key
     * @return value or null when absent or blank
     */
    public String metadataValue(String key) {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String s = String.valueOf(value);
        return s.isBlank() ? null : s;
    }

    /**
     * Failure reason recorded on the payment row.
     *
     * @return gateway response message, or the status when Tap sent none
     */
    public String failureReason() {
        if (response != null && response.message() != null && !response.message().isBlank()) {
            return response.message();
        }
        return status;
    }
}

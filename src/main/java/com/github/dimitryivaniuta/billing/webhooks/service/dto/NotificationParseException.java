package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import lombok.Getter;

/**
 * Thrown when an incoming notification cannot be turned into a {@link TapNotification}.
 */
@Getter
public class NotificationParseException extends RuntimeException {

    public static final String INVALID_PAYLOAD = "invalid_payload";
    public static final String NO_CHARGE_ID = "no_charge_id";

    /**
     * Wire reason returned to the caller.
     */
    private final String reason;

    public NotificationParseException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public NotificationParseException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}

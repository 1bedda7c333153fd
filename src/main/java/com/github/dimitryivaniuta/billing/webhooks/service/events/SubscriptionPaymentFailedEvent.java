package com.github.dimitryivaniuta.billing.webhooks.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted when the gateway reports a failed, declined or cancelled charge.
 */
public record SubscriptionPaymentFailedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String subscriptionId,
        String userId,
        String chargeId,
        String gatewayStatus,
        BigDecimal amount,
        String failureReason
) {
    public static final String TYPE = "SubscriptionPaymentFailed";
}

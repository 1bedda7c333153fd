package com.github.dimitryivaniuta.billing.webhooks.service.events;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted when a verified capture activates (or renews) a subscription.
 *
 * <p>Stored in the outbox and later published to Kafka. Consumers send the confirmation email and refresh
 * the user's profile status.</p>
 */
public record SubscriptionActivatedEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        String subscriptionId,
        String userId,
        String serviceId,
        String chargeId,
        BigDecimal amount,
        String currency,
        boolean renewal,
        Instant nextBillingDate
) {
    public static final String TYPE = "SubscriptionActivated";
}

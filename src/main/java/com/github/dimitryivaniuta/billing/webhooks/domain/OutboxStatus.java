package com.github.dimitryivaniuta.billing.webhooks.domain;

/**
 * Outbox delivery status, stored as VARCHAR.
 */
public enum OutboxStatus {
    /** Written with the subscription change, never attempted. */
    NEW,
    /** Failed before; retried after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    SENT,
    /** Gave up after max attempts. */
    DEAD
}

package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Billing event written in the same transaction as a subscription transition and published to Kafka later.
 *
 * <p>Keyed by subscription id so all events of one subscription land on the same partition in order.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
)
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    /** Aggregate type of every event this service emits. */
    public static final String SUBSCRIPTION_AGGREGATE = "Subscription";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "aggregate_type", nullable = false, length = 64)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 64)
    private String aggregateId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "event_key", nullable = false, length = 128)
    private String eventKey;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates a NEW event for a subscription.
     *
     * @param subscriptionId subscription id (aggregate id and Kafka key)
     * @param eventType      event type, e.g. {@code SubscriptionActivated}
     * @param payload        JSON payload
     * @return event
     */
    public static OutboxEvent forSubscription(String subscriptionId, String eventType, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.aggregateType = SUBSCRIPTION_AGGREGATE;
        e.aggregateId = subscriptionId;
        e.eventType = eventType;
        e.eventKey = subscriptionId;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    /**
     * Broker acknowledged the event.
     */
    public void markSent(Instant now) {
        this.status = OutboxStatus.SENT;
        this.sentAt = now;
        this.updatedAt = now;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Counts a failed attempt and either parks the event until {@code now + backoff} or, once
     * {@code maxAttempts} is reached, gives up on it.
     *
     * @return the status after this attempt, {@link OutboxStatus#RETRY} or {@link OutboxStatus#DEAD}
     */
    public OutboxStatus recordFailedAttempt(String error, Instant now, Duration backoff, int maxAttempts) {
        this.attemptCount++;
        this.lastError = error;
        this.updatedAt = now;
        if (attemptCount >= maxAttempts) {
            this.status = OutboxStatus.DEAD;
            this.nextAttemptAt = null;
        } else {
            this.status = OutboxStatus.RETRY;
            this.nextAttemptAt = now.plus(backoff);
        }
        return status;
    }
}

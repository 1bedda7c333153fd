package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Idempotency ledger row: one per (provider, charge id, claimed status) ever received.
 *
 * <p>The unique constraint is the real duplicate guard. Rows are inserted with
 * {@code ON CONFLICT DO NOTHING} (see {@code ProcessedEventRepository#insertIfAbsent}) and never deleted.
 * The claimed status is part of the key because a charge legitimately moves through several statuses.</p>
 */
@Entity
@Table(
        name = "processed_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_processed_events_provider_charge_status",
                columnNames = {"provider", "charge_id", "status"}),
        indexes = @Index(name = "idx_processed_events_charge_id", columnList = "charge_id")
)
@Getter
@Setter
@NoArgsConstructor
public class ProcessedEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "provider", nullable = false, updatable = false, length = 32)
    private String provider;

    @Column(name = "provider_event_id", length = 128)
    private String providerEventId;

    @Column(name = "charge_id", nullable = false, updatable = false, length = 128)
    private String chargeId;

    @Column(name = "status", nullable = false, updatable = false, length = 32)
    private String status;

    @Column(name = "payload_json", nullable = false, columnDefinition = "text")
    private String payloadJson;

    @Column(name = "verified_json", columnDefinition = "text")
    private String verifiedJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 32)
    private ProcessingOutcome processingResult;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "subscription_id", length = 64)
    private String subscriptionId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "amount", precision = 12, scale = 3)
    private BigDecimal amount;

    @Column(name = "currency", length = 8)
    private String currency;

    @Column(name = "error_details", columnDefinition = "text")
    private String errorDetails;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * True once a final outcome has been recorded that a redelivery must not override.
     *
     * @return whether the event is already processed
     */
    public boolean isProcessed() {
        return processedAt != null && processingResult != null && !processingResult.isRetryable();
    }
}

package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only record of one webhook attempt, written whether or not processing succeeded.
 *
 * <p>Carries the raw payload and the verification trail so an attempt can be reconstructed without
 * re-deriving it from mutable subscription state. There are no setters: rows are never updated.</p>
 */
@Entity
@Table(
        name = "payment_webhook_events",
        indexes = {
                @Index(name = "idx_payment_webhook_events_charge_id", columnList = "tap_charge_id"),
                @Index(name = "idx_payment_webhook_events_received_at", columnList = "received_at")
        }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WebhookAuditRecord {

    @Id
    @Builder.Default
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id = UUID.randomUUID().toString();

    @Column(name = "request_id", length = 64, updatable = false)
    private String requestId;

    @Builder.Default
    @Column(name = "source", nullable = false, length = 32, updatable = false)
    private String source = "tap_webhook";

    @Column(name = "raw_payload", columnDefinition = "text", updatable = false)
    private String rawPayload;

    @Column(name = "payload_digest", length = 88, updatable = false)
    private String payloadDigest;

    @Enumerated(EnumType.STRING)
    @Column(name = "signature_verdict", length = 32, updatable = false)
    private SignatureVerdict signatureVerdict;

    @Column(name = "verified_with_tap", nullable = false, updatable = false)
    private boolean verifiedWithTap;

    @Column(name = "tap_charge_id", length = 128, updatable = false)
    private String tapChargeId;

    @Column(name = "tap_status", length = 32, updatable = false)
    private String tapStatus;

    @Column(name = "expected_amount_kwd", precision = 12, scale = 3, updatable = false)
    private BigDecimal expectedAmount;

    @Column(name = "actual_amount", precision = 12, scale = 3, updatable = false)
    private BigDecimal actualAmount;

    @Column(name = "actual_currency", length = 8, updatable = false)
    private String actualCurrency;

    @Column(name = "subscription_id", length = 64, updatable = false)
    private String subscriptionId;

    @Column(name = "user_id", length = 64, updatable = false)
    private String userId;

    @Column(name = "verification_result", nullable = false, length = 64, updatable = false)
    private String verificationResult;

    @Column(name = "processing_result", length = 32, updatable = false)
    private String processingResult;

    @Column(name = "error_details", columnDefinition = "text", updatable = false)
    private String errorDetails;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Builder.Default
    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt = Instant.now();
}

package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Discount usage for one subscription, upserted on each successful capture.
 */
@Entity
@Table(
        name = "discount_redemptions",
        uniqueConstraints = @UniqueConstraint(name = "uq_discount_redemptions_code_user_subscription",
                columnNames = {"discount_code_id", "user_id", "subscription_id"})
)
@Getter
@Setter
@NoArgsConstructor
public class DiscountRedemption {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "discount_code_id", nullable = false, length = 64)
    private String discountCodeId;

    @Column(name = "subscription_id", nullable = false, length = 64)
    private String subscriptionId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "cycle_number", nullable = false)
    private int cycleNumber;

    @Column(name = "amount_before_kwd", precision = 12, scale = 3)
    private BigDecimal amountBefore;

    @Column(name = "amount_after_kwd", precision = 12, scale = 3)
    private BigDecimal amountAfter;

    @Column(name = "cycles_applied", nullable = false)
    private int cyclesApplied;

    @Column(name = "total_saved_kwd", precision = 12, scale = 3)
    private BigDecimal totalSaved;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "last_applied_at")
    private Instant lastAppliedAt;
}

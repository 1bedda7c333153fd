package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Billing subscription owned by the coaching application.
 *
 * <p>This service only mutates the payment-related columns, and only through the single-statement updates in
 * {@code SubscriptionRepository}. The {@code validate_subscription_activation} trigger rejects any transition
 * to {@code active} that lacks a verified CAPTURED charge.</p>
 */
@Entity
@Table(name = "subscriptions")
@Getter
@Setter
@NoArgsConstructor
public class Subscription {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "service_id", nullable = false, length = 64)
    private String serviceId;

    @Column(name = "status", nullable = false, length = 32)
    private SubscriptionStatus status;

    @Column(name = "base_price_kwd", precision = 12, scale = 3)
    private BigDecimal basePrice;

    @Column(name = "billing_amount_kwd", precision = 12, scale = 3)
    private BigDecimal billingAmount;

    @Column(name = "billing_currency", length = 8)
    private String currency;

    @Column(name = "discount_code_id", length = 64)
    private String discountCodeId;

    @Column(name = "discount_cycles_used")
    private Integer discountCyclesUsed;

    @Column(name = "tap_charge_id", length = 128)
    private String tapChargeId;

    @Column(name = "tap_subscription_status", length = 32)
    private String tapSubscriptionStatus;

    @Column(name = "last_verified_charge_id", length = 128)
    private String lastVerifiedChargeId;

    @Column(name = "last_payment_verified_at")
    private Instant lastPaymentVerifiedAt;

    @Column(name = "last_payment_status", length = 32)
    private String lastPaymentStatus;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "next_billing_date")
    private Instant nextBillingDate;

    @Column(name = "past_due_since")
    private Instant pastDueSince;

    @Column(name = "payment_failed_at")
    private Instant paymentFailedAt;

    /**
     * Amount the verified charge must match: the discounted billing amount when set, else the base price.
     *
     * @return expected amount or null when the subscription carries no price
     */
    public BigDecimal expectedAmount() {
        return billingAmount != null ? billingAmount : basePrice;
    }

    /**
     * A capture on a past-due subscription is a renewal, not a first activation.
     *
     * @return true for renewals
     */
    public boolean isRenewal() {
        return status == SubscriptionStatus.PAST_DUE || pastDueSince != null;
    }
}

package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.PaymentRecordStatus;
import com.github.dimitryivaniuta.billing.webhooks.domain.SubscriptionPayment;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link SubscriptionPayment}. Rows are only ever written through the upserts below.
 */
public interface SubscriptionPaymentRepository extends JpaRepository<SubscriptionPayment, String> {

    Optional<SubscriptionPayment> findByTapChargeId(String tapChargeId);

    boolean existsByTapChargeIdAndStatus(String tapChargeId, PaymentRecordStatus status);

    /**
     * Upserts the paid row for a charge. A retried identical activation rewrites the same row.
     *
     * @return affected rows
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into subscription_payments
                (id, tap_charge_id, subscription_id, user_id, amount_kwd, status, is_renewal,
                 billing_period_start, billing_period_end, paid_at, metadata, created_at)
            values
                (:id, :chargeId, :subscriptionId, :userId, :amount, 'paid', :renewal,
                 :periodStart, :periodEnd, :paidAt, :metadata, :paidAt)
            on conflict (tap_charge_id) do update
               set status = 'paid',
                   amount_kwd = excluded.amount_kwd,
                   is_renewal = excluded.is_renewal,
                   billing_period_start = excluded.billing_period_start,
                   billing_period_end = excluded.billing_period_end,
                   paid_at = excluded.paid_at,
                   failed_at = null,
                   failure_reason = null,
                   metadata = excluded.metadata
            """, nativeQuery = true)
    int upsertPaid(
            @Param("id") String id,
            @Param("chargeId") String chargeId,
            @Param("subscriptionId") String subscriptionId,
            @Param("userId") String userId,
            @Param("amount") BigDecimal amount,
            @Param("renewal") boolean renewal,
            @Param("periodStart") LocalDate periodStart,
            @Param("periodEnd") LocalDate periodEnd,
            @Param("paidAt") Instant paidAt,
            @Param("metadata") String metadata
    );

    /**
     * Upserts a failed/cancelled row for a charge. A row that is already {@code paid} is never downgraded.
     *
     * @param status {@code failed} or {@code cancelled}
     * @return affected rows (0 when the charge is already paid)
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into subscription_payments
                (id, tap_charge_id, subscription_id, user_id, amount_kwd, status, is_renewal,
                 failed_at, failure_reason, created_at)
            values
                (:id, :chargeId, :subscriptionId, :userId, :amount, :status, false,
                 :failedAt, :failureReason, :failedAt)
            on conflict (tap_charge_id) do update
               set status = excluded.status,
                   failed_at = excluded.failed_at,
                   failure_reason = excluded.failure_reason
             where subscription_payments.status <> 'paid'
            """, nativeQuery = true)
    int upsertFailed(
            @Param("id") String id,
            @Param("chargeId") String chargeId,
            @Param("subscriptionId") String subscriptionId,
            @Param("userId") String userId,
            @Param("amount") BigDecimal amount,
            @Param("status") String status,
            @Param("failedAt") Instant failedAt,
            @Param("failureReason") String failureReason
    );
}

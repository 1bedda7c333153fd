package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.Subscription;
import com.github.dimitryivaniuta.billing.webhooks.domain.SubscriptionStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link Subscription}.
 *
 * <p>Every mutation is a single UPDATE statement so the activation trigger sees all verification fields
 * together. Callers own the transaction.</p>
 */
public interface SubscriptionRepository extends JpaRepository<Subscription, String> {

    Optional<Subscription> findByUserIdAndServiceId(String userId, String serviceId);

    Optional<Subscription> findFirstByTapChargeId(String tapChargeId);

    /**
     * Loads a subscription and locks its row until the surrounding transaction ends.
     *
     * <p>Serializes transitions of one subscription, so the "already paid" check and the writes that follow
     * cannot interleave with a concurrent delivery for the same charge.</p>
     *
     * @param id subscription id
     * @return locked subscription
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Subscription s where s.id = :id")
    Optional<Subscription> lockById(@Param("id") String id);

    /**
     * Activates a subscription from a verified capture.
     *
     * @param id             subscription id
     * @param chargeId       verified charge id
     * @param capturedStatus gateway status string written to the verification fields
     * @param now            activation instant (start date and verification timestamp)
     * @param nextBilling    next billing date
     * @return number of updated rows
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Subscription s
               set s.status = :active,
                   s.startDate = :now,
                   s.nextBillingDate = :nextBilling,
                   s.lastVerifiedChargeId = :chargeId,
                   s.lastPaymentVerifiedAt = :now,
                   s.lastPaymentStatus = :capturedStatus,
                   s.tapChargeId = :chargeId,
                   s.tapSubscriptionStatus = :capturedStatus,
                   s.pastDueSince = null,
                   s.paymentFailedAt = null
             where s.id = :id
            """)
    int activate(
            @Param("id") String id,
            @Param("chargeId") String chargeId,
            @Param("capturedStatus") String capturedStatus,
            @Param("now") Instant now,
            @Param("nextBilling") Instant nextBilling,
            @Param("active") SubscriptionStatus active
    );

    /**
     * Moves a non-cancelled subscription to past due. Verification fields are left untouched.
     *
     * @return number of updated rows (0 for cancelled subscriptions)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Subscription s
               set s.status = :pastDue,
                   s.pastDueSince = coalesce(s.pastDueSince, :now),
                   s.paymentFailedAt = :now,
                   s.lastPaymentStatus = :gatewayStatus,
                   s.tapSubscriptionStatus = :gatewayStatus
             where s.id = :id and s.status <> :cancelled
            """)
    int markPastDue(
            @Param("id") String id,
            @Param("gatewayStatus") String gatewayStatus,
            @Param("now") Instant now,
            @Param("pastDue") SubscriptionStatus pastDue,
            @Param("cancelled") SubscriptionStatus cancelled
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Subscription s set s.discountCyclesUsed = 1, s.discountCodeId = :discountCodeId where s.id = :id")
    int markDiscountApplied(@Param("id") String id, @Param("discountCodeId") String discountCodeId);
}

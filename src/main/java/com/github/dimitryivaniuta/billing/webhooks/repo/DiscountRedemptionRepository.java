package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.DiscountRedemption;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DiscountRedemptionRepository extends JpaRepository<DiscountRedemption, String> {

    Optional<DiscountRedemption> findByDiscountCodeIdAndUserIdAndSubscriptionId(
            String discountCodeId, String userId, String subscriptionId);

    @Modifying(flushAutomatically = true)
    @Query(value = """
            insert into discount_redemptions
                (id, discount_code_id, subscription_id, user_id, cycle_number, amount_before_kwd, amount_after_kwd,
                 cycles_applied, total_saved_kwd, status, last_applied_at)
            values
                (:id, :discountCodeId, :subscriptionId, :userId, 1, :amountBefore, :amountAfter,
                 1, :totalSaved, 'active', :appliedAt)
            on conflict (discount_code_id, user_id, subscription_id) do update
               set amount_before_kwd = excluded.amount_before_kwd,
                   amount_after_kwd = excluded.amount_after_kwd,
                   total_saved_kwd = excluded.total_saved_kwd,
                   last_applied_at = excluded.last_applied_at
            """, nativeQuery = true)
    int upsert(
            @Param("id") String id,
            @Param("discountCodeId") String discountCodeId,
            @Param("subscriptionId") String subscriptionId,
            @Param("userId") String userId,
            @Param("amountBefore") BigDecimal amountBefore,
            @Param("amountAfter") BigDecimal amountAfter,
            @Param("totalSaved") BigDecimal totalSaved,
            @Param("appliedAt") Instant appliedAt
    );
}

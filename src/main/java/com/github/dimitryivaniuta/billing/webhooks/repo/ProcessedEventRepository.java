package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessedEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repository for the idempotency ledger ({@link ProcessedEvent}).
 */
public interface ProcessedEventRepository extends JpaRepository<ProcessedEvent, String> {

    /**
     * Finds the ledger row for a (provider, charge, claimed status) key.
     *
     * @param provider provider name
     * @param chargeId charge id
     * @param status   claimed status
     * @return row
     */
    Optional<ProcessedEvent> findByProviderAndChargeIdAndStatus(String provider, String chargeId, String status);

    /**
     * Inserts a pending ledger row unless the (provider, charge_id, status) key already exists.
     *
     * <p>Concurrent deliveries of the same notification race on the unique index; exactly one of them gets
     * {@code 1} back. Doing nothing on conflict keeps the surrounding transaction usable.</p>
     *
     * @return 1 if inserted, 0 if the key already existed
     */
    @Transactional
    @Modifying
    @Query(value = """
            insert into processed_events
                (id, provider, provider_event_id, charge_id, status, payload_json, amount, currency, source, created_at)
            values
                (:id, :provider, :providerEventId, :chargeId, :status, :payloadJson, :amount, :currency, 'webhook', :createdAt)
            on conflict (provider, charge_id, status) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("id") String id,
            @Param("provider") String provider,
            @Param("providerEventId") String providerEventId,
            @Param("chargeId") String chargeId,
            @Param("status") String status,
            @Param("payloadJson") String payloadJson,
            @Param("amount") BigDecimal amount,
            @Param("currency") String currency,
            @Param("createdAt") Instant createdAt
    );

    /**
     * Re-claims a row whose previous attempt ended in a retryable outcome (gateway unreachable, storage error).
     *
     * <p>Conditional on the retryable outcome, so among concurrent redeliveries only one gets {@code 1}.</p>
     *
     * @return 1 if this caller claimed the row
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ProcessedEvent e
               set e.processingResult = null, e.processedAt = null, e.errorDetails = null, e.payloadJson = :payloadJson
             where e.provider = :provider and e.chargeId = :chargeId and e.status = :status
               and e.processingResult in :retryable
            """)
    int reclaim(
            @Param("provider") String provider,
            @Param("chargeId") String chargeId,
            @Param("status") String status,
            @Param("payloadJson") String payloadJson,
            @Param("retryable") Collection<ProcessingOutcome> retryable
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ProcessedEvent e set e.verifiedJson = :verifiedJson
             where e.provider = :provider and e.chargeId = :chargeId and e.status = :status
            """)
    int markVerified(
            @Param("provider") String provider,
            @Param("chargeId") String chargeId,
            @Param("status") String status,
            @Param("verifiedJson") String verifiedJson
    );

    /**
     * Records the final outcome. {@code processedAt} is null for retryable outcomes.
     *
     * @return number of updated rows
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update ProcessedEvent e
               set e.processingResult = :outcome, e.processedAt = :processedAt,
                   e.subscriptionId = :subscriptionId, e.userId = :userId, e.errorDetails = :errorDetails
             where e.provider = :provider and e.chargeId = :chargeId and e.status = :status
            """)
    int markFinal(
            @Param("provider") String provider,
            @Param("chargeId") String chargeId,
            @Param("status") String status,
            @Param("outcome") ProcessingOutcome outcome,
            @Param("processedAt") Instant processedAt,
            @Param("subscriptionId") String subscriptionId,
            @Param("userId") String userId,
            @Param("errorDetails") String errorDetails
    );
}

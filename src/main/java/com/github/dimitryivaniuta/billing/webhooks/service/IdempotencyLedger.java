package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessedEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;
import com.github.dimitryivaniuta.billing.webhooks.repo.ProcessedEventRepository;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.CachedLedgerOutcome;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.LedgerLookup;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Idempotency ledger keyed by (provider, charge id, claimed status).
 *
 * <p>Concurrency approach:
 * <ol>
 *   <li>{@link #seen} is a cheap early exit (Redis, then Postgres). It is an optimization only.</li>
 *   <li>{@link #recordPending} is the real guard: {@code INSERT ... ON CONFLICT DO NOTHING} on the unique key.
 *       Among concurrent deliveries exactly one gets an affected-row count of 1.</li>
 *   <li>A row left at a retryable outcome ({@code VERIFICATION_FAILED}, {@code INTERNAL_ERROR}) is re-claimed
 *       by one conditional UPDATE, so a gateway outage or a storage timeout does not block the key forever.</li>
 * </ol>
 */
@Service
public class IdempotencyLedger {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyLedger.class);

    private final ProcessedEventRepository repository;
    private final LedgerCacheService cacheService;
    private final String provider;
    private final Clock clock;

    public IdempotencyLedger(
            ProcessedEventRepository repository,
            LedgerCacheService cacheService,
            AppProperties properties,
            Clock clock
    ) {
        this.repository = repository;
        this.cacheService = cacheService;
        this.provider = properties.getTap().getProvider();
        this.clock = clock;
    }

    /**
     * Looks up a final outcome for the key.
     *
     * @param chargeId charge id
     * @param status   claimed status (ledger form, never null)
     * @return lookup; {@code exists} only when a non-retryable outcome is recorded
     */
    public LedgerLookup seen(String chargeId, String status) {
        CachedLedgerOutcome cached = cacheService.get(chargeId, status);
        if (cached != null) {
            return LedgerLookup.processed(cached.outcome());
        }

        return repository.findByProviderAndChargeIdAndStatus(provider, chargeId, status)
                .filter(ProcessedEvent::isProcessed)
                .map(e -> {
                    cacheService.put(new CachedLedgerOutcome(chargeId, status, e.getProcessingResult()));
                    return LedgerLookup.processed(e.getProcessingResult());
                })
                .orElseGet(LedgerLookup::notFound);
    }

    /**
     * Claims the key for this delivery.
     *
     * @param notification notification
     * @return true if this caller owns the key; false for a duplicate
     */
    public boolean recordPending(TapNotification notification) {
        String status = notification.ledgerStatus();
        int inserted = repository.insertIfAbsent(
                UUID.randomUUID().toString(),
                provider,
                notification.providerEventId(),
                notification.chargeId(),
                status,
                notification.rawBody(),
                notification.amount(),
                notification.currency(),
                clock.instant()
        );
        if (inserted == 1) {
            return true;
        }

        int reclaimed = repository.reclaim(provider, notification.chargeId(), status, notification.rawBody(),
                ProcessingOutcome.retryable());
        if (reclaimed == 1) {
            log.info("Re-claimed ledger row after an earlier retryable failure. chargeId={} status={}",
                    notification.chargeId(), status);
            return true;
        }
        return false;
    }

    /**
     * Stores the authoritative charge payload.
     */
    public void recordVerified(String chargeId, String status, String verifiedJson) {
        repository.markVerified(provider, chargeId, status, verifiedJson);
    }

    /**
     * Stores the final outcome. Retryable outcomes leave {@code processed_at} unset and are not cached.
     *
     * @param chargeId       charge id
     * @param status         claimed status
     * @param outcome        outcome
     * @param subscriptionId subscription id, may be null
     * @param userId         user id, may be null
     * @param error          error detail, may be null
     */
    public void recordFinal(String chargeId, String status, ProcessingOutcome outcome,
                            String subscriptionId, String userId, String error) {
        Instant processedAt = outcome.isRetryable() ? null : clock.instant();
        repository.markFinal(provider, chargeId, status, outcome, processedAt, subscriptionId, userId, error);
        if (!outcome.isRetryable()) {
            cacheService.put(new CachedLedgerOutcome(chargeId, status, outcome));
        }
    }
}

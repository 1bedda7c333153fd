package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.service.dto.CachedLedgerOutcome;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import static com.github.dimitryivaniuta.billing.webhooks.config.CacheConfig.LEDGER_CACHE;

/**
 * Optional Redis-backed cache for final ledger outcomes.
 *
 * <p>Postgres remains the source of truth; cache misses fall back to DB.</p>
 */
@Service
public class LedgerCacheService {

    /**
     * Gets a cached outcome if present.
     *
     * @param chargeId charge id
     * @param status   claimed status
     * @return cached outcome or null
     */
    @Cacheable(cacheNames = LEDGER_CACHE, key = "T(String).valueOf(#chargeId).concat(':').concat(#status)", unless = "#result == null")
    public CachedLedgerOutcome get(String chargeId, String status) {
        return null; // Spring Cache will bypass method body on cache hit.
    }

    /**
     * Stores a final outcome.
     *
     * @param outcome outcome to cache
     * @return outcome
     */
    @CachePut(cacheNames = LEDGER_CACHE, key = "T(String).valueOf(#outcome.chargeId()).concat(':').concat(#outcome.status())")
    public CachedLedgerOutcome put(CachedLedgerOutcome outcome) {
        return outcome;
    }
}

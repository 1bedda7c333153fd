package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.RateLimitDecision;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Token bucket rate limiter for webhook traffic.
 *
 * <ul>
 *   <li>Per source address: {@code ipMaxRequests} tokens, refilled all at once every {@code ipWindow}.</li>
 *   <li>Per charge id: a cap bucket of {@code chargeMaxVerifications} per {@code chargeWindow} and a spacing
 *       bucket of one token per {@code chargeThrottle}.</li>
 * </ul>
 *
 * <p>Buckets are local to this instance. Interval refills start when a key's bucket is created, so each window
 * is measured from the first hit. Buckets idle for a whole window are full again and get evicted.</p>
 */
@Component
public class WebhookRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(WebhookRateLimiter.class);

    private final Map<String, Tracked<Bucket>> sourceBuckets = new ConcurrentHashMap<>();
    private final Map<String, Tracked<ChargeBuckets>> chargeBuckets = new ConcurrentHashMap<>();

    private final AppProperties.RateLimit limits;
    private final Clock clock;
    private final TimeMeter timeMeter;

    public WebhookRateLimiter(AppProperties properties, Clock clock) {
        this.limits = properties.getRateLimit();
        this.clock = clock;
        this.timeMeter = new ClockTimeMeter(clock);
    }

    /**
     * Counts a request from a source address.
     *
     * @param sourceAddress caller address
     * @return decision
     */
    public RateLimitDecision allowSource(String sourceAddress) {
        Tracked<Bucket> tracked = sourceBuckets.computeIfAbsent(sourceAddress, k -> new Tracked<>(newSourceBucket()));
        tracked.touch(clock.instant());
        return tracked.value.tryConsume(1)
                ? RateLimitDecision.allow()
                : RateLimitDecision.deny(RateLimitDecision.IP_RATE_LIMITED);
    }

    /**
     * Counts a verification attempt for a charge.
     *
     * @param chargeId charge id
     * @return decision; denied with {@code charge_rate_limited} when the cap is reached,
     *         {@code charge_throttled} when the previous accepted attempt was too recent
     */
    public RateLimitDecision allowCharge(String chargeId) {
        Tracked<ChargeBuckets> tracked = chargeBuckets.computeIfAbsent(chargeId, k -> new Tracked<>(newChargeBuckets()));
        tracked.touch(clock.instant());
        ChargeBuckets buckets = tracked.value;

        // both buckets change together or not at all
        synchronized (buckets) {
            if (buckets.cap().getAvailableTokens() < 1) {
                return RateLimitDecision.deny(RateLimitDecision.CHARGE_RATE_LIMITED);
            }
            if (buckets.spacing() != null && !buckets.spacing().tryConsume(1)) {
                return RateLimitDecision.deny(RateLimitDecision.CHARGE_THROTTLED);
            }
            buckets.cap().tryConsume(1);
            return RateLimitDecision.allow();
        }
    }

    /**
     * Drops buckets that have been idle for a whole window so idle keys do not accumulate.
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = sourceBuckets.size() + chargeBuckets.size();
        sourceBuckets.values().removeIf(t -> t.idleFor(now, limits.getIpWindow()));
        Duration chargeIdle = max(limits.getChargeWindow(), limits.getChargeThrottle());
        chargeBuckets.values().removeIf(t -> t.idleFor(now, chargeIdle));
        int evicted = before - sourceBuckets.size() - chargeBuckets.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit buckets", evicted);
        }
    }

    private Bucket newSourceBucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limits.getIpMaxRequests())
                        .refillIntervally(limits.getIpMaxRequests(), limits.getIpWindow())
                        .build())
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private ChargeBuckets newChargeBuckets() {
        Bucket cap = Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limits.getChargeMaxVerifications())
                        .refillIntervally(limits.getChargeMaxVerifications(), limits.getChargeWindow())
                        .build())
                .withCustomTimePrecision(timeMeter)
                .build();
        Duration throttle = limits.getChargeThrottle();
        if (throttle.isZero() || throttle.isNegative()) {
            return new ChargeBuckets(cap, null);
        }
        Bucket spacing = Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(1)
                        .refillIntervally(1, throttle)
                        .build())
                .withCustomTimePrecision(timeMeter)
                .build();
        return new ChargeBuckets(cap, spacing);
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** {@code spacing} is null when the charge throttle is disabled. */
    private record ChargeBuckets(Bucket cap, Bucket spacing) {}

    private static final class Tracked<T> {
        private final T value;
        private volatile Instant lastSeen = Instant.MIN;

        private Tracked(T value) {
            this.value = value;
        }

        private void touch(Instant now) {
            lastSeen = now;
        }

        private boolean idleFor(Instant now, Duration window) {
            return !now.isBefore(lastSeen.plus(window));
        }
    }

    /**
     * Feeds the injected {@link Clock} to Bucket4j.
     */
    private record ClockTimeMeter(Clock clock) implements TimeMeter {

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}

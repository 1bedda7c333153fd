package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.RateLimitDecision;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookRateLimiterTest {

    private MutableClock clock;
    private WebhookRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        limiter = new WebhookRateLimiter(new AppProperties(), clock);
    }

    @Test
    void sourceAddressIsCappedPerWindow() {
        for (int i = 0; i < 30; i++) {
            Assertions.assertTrue(limiter.allowSource("1.1.1.1").allowed(), "request " + (i + 1));
        }

        RateLimitDecision denied = limiter.allowSource("1.1.1.1");
        Assertions.assertFalse(denied.allowed());
        Assertions.assertEquals(RateLimitDecision.IP_RATE_LIMITED, denied.reason());

        Assertions.assertTrue(limiter.allowSource("2.2.2.2").allowed(), "other sources are counted separately");
    }

    @Test
    void sourceWindowReopensAfterExpiry() {
        for (int i = 0; i < 31; i++) {
            limiter.allowSource("1.1.1.1");
        }
        clock.advance(Duration.ofSeconds(60));

        Assertions.assertTrue(limiter.allowSource("1.1.1.1").allowed());
    }

    @Test
    void chargeVerificationsMustBeSpacedOut() {
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());

        clock.advance(Duration.ofSeconds(1));
        RateLimitDecision tooSoon = limiter.allowCharge("chg_1");
        Assertions.assertFalse(tooSoon.allowed());
        Assertions.assertEquals(RateLimitDecision.CHARGE_THROTTLED, tooSoon.reason());

        clock.advance(Duration.ofSeconds(5));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
    }

    @Test
    void chargeIsCappedWithinWindowAndResetsAfterIt() {
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(6));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(6));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());

        clock.advance(Duration.ofSeconds(6));
        RateLimitDecision capped = limiter.allowCharge("chg_1");
        Assertions.assertFalse(capped.allowed());
        Assertions.assertEquals(RateLimitDecision.CHARGE_RATE_LIMITED, capped.reason());

        // window measured from the first hit (t=0): reopens at t=60s
        clock.set(Instant.parse("2024-01-01T00:01:00Z"));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
    }

    @Test
    void deniedAttemptsDoNotMoveTheThrottle() {
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(4));
        Assertions.assertFalse(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(1));

        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed(), "5s after the last accepted attempt");
    }

    @Test
    void zeroThrottleLeavesOnlyTheCap() {
        AppProperties properties = new AppProperties();
        properties.getRateLimit().setChargeThrottle(Duration.ZERO);
        WebhookRateLimiter unthrottled = new WebhookRateLimiter(properties, clock);

        for (int i = 0; i < 3; i++) {
            Assertions.assertTrue(unthrottled.allowCharge("chg_1").allowed(), "attempt " + (i + 1));
        }
        Assertions.assertEquals(RateLimitDecision.CHARGE_RATE_LIMITED, unthrottled.allowCharge("chg_1").reason());
    }

    @Test
    void cappedChargeIsNotReportedAsThrottled() {
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(5));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
        clock.advance(Duration.ofSeconds(5));
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());

        // spacing bucket is empty as well, the cap wins
        Assertions.assertEquals(RateLimitDecision.CHARGE_RATE_LIMITED, limiter.allowCharge("chg_1").reason());
        clock.advance(Duration.ofSeconds(5));
        Assertions.assertEquals(RateLimitDecision.CHARGE_RATE_LIMITED, limiter.allowCharge("chg_1").reason());
    }

    @Test
    void evictionDropsExpiredWindows() {
        limiter.allowCharge("chg_1");
        for (int i = 0; i < 31; i++) {
            limiter.allowSource("1.1.1.1");
        }
        clock.advance(Duration.ofMinutes(2));

        limiter.evictExpired();

        Assertions.assertTrue(limiter.allowSource("1.1.1.1").allowed());
        Assertions.assertTrue(limiter.allowCharge("chg_1").allowed());
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        void set(Instant instant) {
            now = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

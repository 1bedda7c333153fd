package com.github.dimitryivaniuta.billing.webhooks.service.dto;

/**
 * Rate limiter verdict.
 *
 * @param allowed whether the request may proceed
 * @param reason  {@code ip_rate_limited}, {@code charge_rate_limited} or {@code charge_throttled} when denied
 */
public record RateLimitDecision(boolean allowed, String reason) {

    public static final String IP_RATE_LIMITED = "ip_rate_limited";
    public static final String CHARGE_RATE_LIMITED = "charge_rate_limited";
    public static final String CHARGE_THROTTLED = "charge_throttled";

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, null);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision deny(String reason) {
        return new RateLimitDecision(false, reason);
    }
}

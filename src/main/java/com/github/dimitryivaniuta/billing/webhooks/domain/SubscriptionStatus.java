package com.github.dimitryivaniuta.billing.webhooks.domain;

import java.util.Arrays;

/**
 * Subscription status as stored by the billing application (lowercase strings).
 */
public enum SubscriptionStatus {
    PENDING("pending"),
    ACTIVE("active"),
    PAST_DUE("past_due"),
    CANCELLED("cancelled");

    private final String dbValue;

    SubscriptionStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Resolves a stored value.
     *
     * @param value column value
     * @return status
     * @throws IllegalArgumentException for unknown values
     */
    public static SubscriptionStatus fromDb(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscription status: " + value));
    }
}

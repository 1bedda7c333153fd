package com.github.dimitryivaniuta.billing.webhooks.domain;

import java.util.Arrays;

/**
 * Status of a {@link SubscriptionPayment} row (lowercase strings in the database).
 */
public enum PaymentRecordStatus {
    PAID("paid"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String dbValue;

    PaymentRecordStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static PaymentRecordStatus fromDb(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }
}

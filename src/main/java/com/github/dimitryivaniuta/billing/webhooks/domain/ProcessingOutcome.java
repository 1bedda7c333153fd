package com.github.dimitryivaniuta.billing.webhooks.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Final outcome of processing one (charge, claimed status) notification.
 *
 * <p>Stored as the enum name; {@link #wireName()} is what webhook callers and the audit log see.</p>
 */
public enum ProcessingOutcome {
    /** Subscription activated by a verified, matching capture. */
    ACTIVATED,
    /** A paid payment row already exists for this charge. */
    ALREADY_ACTIVE,
    /** Verified declined/failed/cancelled charge applied as past due. */
    FAILED,
    /** Non-terminal or unrecognized gateway status. */
    IGNORED,
    AMOUNT_MISMATCH,
    CURRENCY_MISMATCH,
    INVALID_STATUS,
    /** The atomic activation update was rejected by storage. */
    ACTIVATION_FAILED,
    /** Authoritative fetch failed; the ledger row can be re-claimed by a redelivery. */
    VERIFICATION_FAILED,
    SUBSCRIPTION_NOT_FOUND,
    /** Storage or unexpected failure after the key was claimed; the ledger row can be re-claimed. */
    INTERNAL_ERROR;

    private static final Set<ProcessingOutcome> RETRYABLE = EnumSet.of(VERIFICATION_FAILED, INTERNAL_ERROR);

    /**
     * Lowercase snake case name used on the wire.
     *
     * @return wire name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a redelivery of the same (charge, status) may process this event again.
     *
     * @return true if re-claimable
     */
    public boolean isRetryable() {
        return RETRYABLE.contains(this);
    }

    /**
     * Outcomes a redelivery may re-claim.
     *
     * @return retryable outcomes
     */
    public static Set<ProcessingOutcome> retryable() {
        return RETRYABLE;
    }
}

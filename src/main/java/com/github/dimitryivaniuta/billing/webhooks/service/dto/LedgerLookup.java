package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;

/**
 * Result of an idempotency ledger lookup.
 *
 * @param exists       whether a final outcome is recorded for the key
 * @param priorOutcome recorded outcome, null when {@code exists} is false
 */
public record LedgerLookup(boolean exists, ProcessingOutcome priorOutcome) {

    public static LedgerLookup notFound() {
        return new LedgerLookup(false, null);
    }

    public static LedgerLookup processed(ProcessingOutcome outcome) {
        return new LedgerLookup(true, outcome);
    }
}

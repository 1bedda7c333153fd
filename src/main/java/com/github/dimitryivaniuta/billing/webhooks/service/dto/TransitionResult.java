package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;

/**
 * Outcome of applying a verified charge to a subscription.
 *
 * @param outcome outcome
 * @param error   detail for rejected or failed transitions, otherwise null
 */
public record TransitionResult(ProcessingOutcome outcome, String error) {

    public static TransitionResult of(ProcessingOutcome outcome) {
        return new TransitionResult(outcome, null);
    }

    public static TransitionResult rejected(ProcessingOutcome outcome, String error) {
        return new TransitionResult(outcome, error);
    }
}

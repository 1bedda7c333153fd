package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;

/**
 * Cached final ledger outcome (Redis optimization).
 *
 * @param chargeId charge id
 * @param status   claimed status the outcome belongs to
 * @param outcome  final processing outcome
 */
public record CachedLedgerOutcome(String chargeId, String status, ProcessingOutcome outcome) {}

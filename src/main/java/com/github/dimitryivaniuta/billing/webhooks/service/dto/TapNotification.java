package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Incoming webhook notification as claimed by the caller. Nothing in here is trusted.
 *
 * @param rawBody          raw request body
 * @param signature        {@code hashstring} header, null when absent
 * @param sourceAddress    caller address
 * @param chargeId         {@code id}, falling back to {@code charge_id}
 * @param status           claimed status, null when absent
 * @param amount           claimed amount
 * @param currency         claimed currency
 * @param gatewayReference {@code reference.gateway}
 * @param paymentReference {@code reference.payment}
 * @param created          {@code transaction.created}
 * @param providerEventId  {@code event_id}
 * @param metadata         merchant metadata
 */
public record TapNotification(
        String rawBody,
        String signature,
        String sourceAddress,
        String chargeId,
        String status,
        BigDecimal amount,
        String currency,
        String gatewayReference,
        String paymentReference,
        String created,
        String providerEventId,
        Map<String, Object> metadata
) {

    /**
     * Ledger key component used when the caller sent no status.
     */
    public static final String UNKNOWN_STATUS = "UNKNOWN";

    public String ledgerStatus() {
        return status == null || status.isBlank() ? UNKNOWN_STATUS : status;
    }

    public boolean hasSignature() {
        return signature != null && !signature.isBlank();
    }
}

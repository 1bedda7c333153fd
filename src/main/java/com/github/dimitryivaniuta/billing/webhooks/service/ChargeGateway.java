package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.service.dto.GatewayVerification;

/**
 * Authoritative source of charge state.
 *
 * <p>Implementations never throw for transport or protocol failures; they report them as an unsuccessful
 * {@link GatewayVerification} so the caller can record {@code verification_failed}.</p>
 */
public interface ChargeGateway {

    /**
     * Fetches a charge from the gateway.
     *
     * @param chargeId charge id
     * @return verification result
     */
    GatewayVerification verify(String chargeId);
}

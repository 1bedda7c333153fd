package com.github.dimitryivaniuta.billing.webhooks.service.dto;

/**
 * Result of fetching a charge from the gateway.
 *
 * @param success whether the charge was fetched and parsed
 * @param charge  authoritative charge, null on failure
 * @param rawJson response body as received, stored as the verified payload
 * @param error   error string on failure, e.g. {@code TAP API: 404}
 */
public record GatewayVerification(boolean success, TapCharge charge, String rawJson, String error) {

    public static GatewayVerification verified(TapCharge charge, String rawJson) {
        return new GatewayVerification(true, charge, rawJson, null);
    }

    public static GatewayVerification failed(String error) {
        return new GatewayVerification(false, null, null, error);
    }
}

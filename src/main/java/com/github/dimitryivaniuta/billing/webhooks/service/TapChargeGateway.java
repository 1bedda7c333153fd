package com.github.dimitryivaniuta.billing.webhooks.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.GatewayVerification;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapCharge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link ChargeGateway} backed by Tap's {@code GET /v2/charges/{id}}.
 *
 * <p>The {@link RestClient} carries the base URL, bearer credential and timeouts (see {@code TapClientConfig}).
 * There are no retries here: Tap redelivers the webhook, and a failed verification leaves the ledger row
 * re-claimable.</p>
 */
@Component
public class TapChargeGateway implements ChargeGateway {

    private static final Logger log = LoggerFactory.getLogger(TapChargeGateway.class);

    static final String CHARGE_PATH = "/v2/charges/{chargeId}";

    private final RestClient tapRestClient;
    private final ObjectReader chargeReader;

    public TapChargeGateway(RestClient tapRestClient, ObjectMapper objectMapper) {
        this.tapRestClient = tapRestClient;
        this.chargeReader = objectMapper.readerFor(TapCharge.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public GatewayVerification verify(String chargeId) {
        String body;
        try {
            body = tapRestClient.get()
                    .uri(CHARGE_PATH, chargeId)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.warn("Tap charge lookup failed. chargeId={} status={}", chargeId, e.getStatusCode().value());
            return GatewayVerification.failed("TAP API: " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Tap charge lookup failed. chargeId={} error={}", chargeId, e.getMessage());
            return GatewayVerification.failed(safeError(e));
        }

        if (body == null || body.isBlank()) {
            return GatewayVerification.failed("TAP API: empty response");
        }

        TapCharge charge;
        try {
            charge = chargeReader.readValue(body);
        } catch (JsonProcessingException e) {
            log.warn("Tap charge response unparsable. chargeId={} error={}", chargeId, e.getOriginalMessage());
            return GatewayVerification.failed("TAP API: unparsable response");
        }

        if (charge.id() == null || charge.status() == null) {
            return GatewayVerification.failed("TAP API: response without id or status");
        }
        if (!chargeId.equals(charge.id())) {
            return GatewayVerification.failed("TAP API: charge id mismatch (" + charge.id() + ")");
        }

        log.info("Tap charge verified. chargeId={} status={} amount={} {}",
                chargeId, charge.status(), charge.amount(), charge.currency());
        return GatewayVerification.verified(charge, body);
    }

    private String safeError(Exception ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        if (msg.length() > 2000) {
            msg = msg.substring(0, 2000);
        }
        return msg;
    }
}

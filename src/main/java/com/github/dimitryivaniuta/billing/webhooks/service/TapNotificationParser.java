package com.github.dimitryivaniuta.billing.webhooks.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.NotificationParseException;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns a raw webhook body into a {@link TapNotification}.
 *
 * <p>Only the fields that take part in the signature, the ledger key and subscription lookup are extracted.
 * A body that is not a JSON object, or whose amount is not a number, is an {@code invalid_payload}.
 * A missing charge id is not an error here; the pipeline checks it after the signature.</p>
 */
@Component
public class TapNotificationParser {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public TapNotificationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Parses a notification.
     *
     * @param rawBody       raw request body
     * @param signature     {@code hashstring} header, may be null
     * @param sourceAddress caller address
     * @return notification
     * @throws NotificationParseException with reason {@code invalid_payload}
     */
    public TapNotification parse(String rawBody, String signature, String sourceAddress) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new NotificationParseException(NotificationParseException.INVALID_PAYLOAD, "Empty body");
        }

        JsonNode root;
        try {
            root = reader.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new NotificationParseException(NotificationParseException.INVALID_PAYLOAD, "Body is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new NotificationParseException(NotificationParseException.INVALID_PAYLOAD, "Body is not a JSON object");
        }

        String chargeId = text(root.get("id"));
        if (chargeId == null) {
            chargeId = text(root.get("charge_id"));
        }

        JsonNode reference = root.path("reference");
        JsonNode transaction = root.path("transaction");

        return new TapNotification(
                rawBody,
                signature,
                sourceAddress,
                chargeId,
                text(root.get("status")),
                amount(root.get("amount")),
                text(root.get("currency")),
                text(reference.get("gateway")),
                text(reference.get("payment")),
                text(transaction.get("created")),
                text(root.get("event_id")),
                metadata(root.get("metadata"))
        );
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String s = node.asText();
        return s.isEmpty() ? null : s;
    }

    private static BigDecimal amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new NotificationParseException(NotificationParseException.INVALID_PAYLOAD,
                        "Amount is not a number: " + node.asText(), e);
            }
        }
        throw new NotificationParseException(NotificationParseException.INVALID_PAYLOAD, "Amount is not a number");
    }

    private Map<String, Object> metadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, METADATA_TYPE);
    }
}

package com.github.dimitryivaniuta.billing.webhooks.web;

import com.github.dimitryivaniuta.billing.webhooks.service.TapWebhookProcessor;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.WebhookResult;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives Tap charge notifications.
 *
 * <p>The body is taken as a raw string: the signature covers field values exactly as sent, and an
 * unparsable body must still be acknowledged. Every response is HTTP 200 so Tap stops redelivering; the
 * body says what happened.</p>
 */
@RestController
@RequestMapping("/api/webhooks")
public class TapWebhookController {

    /** Header carrying Tap's HMAC signature. */
    public static final String SIGNATURE_HEADER = "hashstring";

    private final TapWebhookProcessor processor;

    /**
     * Creates the controller.
     *
     * @param processor webhook pipeline
     */
    public TapWebhookController(TapWebhookProcessor processor) {
        this.processor = processor;
    }

    /**
     * Handles a Tap webhook delivery.
     *
     * @param body      raw body
     * @param signature {@code hashstring} header
     * @param request   servlet request (caller address)
     * @return acknowledgement
     */
    @PostMapping(value = "/tap", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WebhookResult> tap(
            @RequestBody(required = false) String body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            HttpServletRequest request
    ) {
        WebhookResult result = processor.process(body, signature, ClientAddresses.resolve(request),
                MDC.get(CorrelationIdFilter.MDC_KEY));
        return ResponseEntity.ok(result);
    }
}

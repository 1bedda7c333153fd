package com.github.dimitryivaniuta.billing.webhooks.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Webhook acknowledgement body. Always returned with HTTP 200; absent fields are omitted.
 *
 * @param received       always true
 * @param processed      a transition was attempted on a verified charge
 * @param duplicate      the notification was already handled
 * @param throttled      rejected by the rate limiter
 * @param ignored        dropped before any state change
 * @param reason         why the request was ignored or throttled
 * @param result         outcome of a processed request
 * @param previousResult outcome recorded for a duplicate
 * @param error          unexpected failure marker
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResult(
        boolean received,
        Boolean processed,
        Boolean duplicate,
        Boolean throttled,
        Boolean ignored,
        String reason,
        String result,
        String previousResult,
        String error
) {

    public static WebhookResult processed(String result) {
        return new WebhookResult(true, true, null, null, null, null, result, null, null);
    }

    public static WebhookResult duplicate(String previousResult) {
        return new WebhookResult(true, null, true, null, null, null, null, previousResult, null);
    }

    public static WebhookResult throttled(String reason) {
        return new WebhookResult(true, null, null, true, null, reason, null, null, null);
    }

    public static WebhookResult ignored(String reason) {
        return new WebhookResult(true, null, null, null, true, reason, null, null, null);
    }

    public static WebhookResult internalError() {
        return new WebhookResult(true, null, null, null, null, null, null, null, "internal_error");
    }
}

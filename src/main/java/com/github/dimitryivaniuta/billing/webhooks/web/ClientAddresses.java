package com.github.dimitryivaniuta.billing.webhooks.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller address used for rate limiting and auditing.
 */
public final class ClientAddresses {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    public static final String UNKNOWN = "unknown";

    private ClientAddresses() {
    }

    /**
     * First entry of {@code X-Forwarded-For}, else the remote address, else {@code unknown}.
     *
     * @param request request
     * @return address
     */
    public static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? UNKNOWN : remote;
    }
}

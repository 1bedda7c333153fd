package com.github.dimitryivaniuta.billing.webhooks.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Access log for webhook deliveries. Slow deliveries are logged at WARN since Tap treats a late
 * acknowledgement as a failed delivery and retries it.
 */
@Slf4j
@Component
public class RequestTimingFilter extends OncePerRequestFilter {

    static final long SLOW_DELIVERY_MS = 3_000;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long started = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (tookMs >= SLOW_DELIVERY_MS) {
                log.warn("Slow webhook delivery {} {} from {} -> {} in {}ms",
                        req.getMethod(), req.getRequestURI(), ClientAddresses.resolve(req), res.getStatus(), tookMs);
            } else {
                log.info("Webhook {} {} from {} -> {} in {}ms",
                        req.getMethod(), req.getRequestURI(), ClientAddresses.resolve(req), res.getStatus(), tookMs);
            }
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(ErrorHandlingAdvice.WEBHOOK_PATH_PREFIX);
    }
}

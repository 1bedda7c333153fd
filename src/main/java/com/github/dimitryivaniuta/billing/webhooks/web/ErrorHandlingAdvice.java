package com.github.dimitryivaniuta.billing.webhooks.web;

import com.github.dimitryivaniuta.billing.webhooks.service.dto.WebhookResult;
import com.github.dimitryivaniuta.billing.webhooks.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception mapping for HTTP APIs.
 *
 * <p>Webhook endpoints never answer with an error status: the gateway would keep redelivering. Anything that
 * escapes the pipeline there is acknowledged with {@code {received:true, error:"internal_error"}}.</p>
 */
@RestControllerAdvice
public class ErrorHandlingAdvice {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandlingAdvice.class);

    static final String WEBHOOK_PATH_PREFIX = "/api/webhooks/";

    /**
     * Known API exceptions.
     *
     * @param ex exception
     * @return response
     */
    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ProblemDetail> handleErrorResponseException(ErrorResponseException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    /**
     * Fallback.
     *
     * @param ex      exception
     * @param request request
     * @return webhook acknowledgement or error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleFallback(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        if (request.getRequestURI().startsWith(WEBHOOK_PATH_PREFIX)) {
            return ResponseEntity.ok(WebhookResult.internalError());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.internal(request.getRequestURI(), MDC.get(CorrelationIdFilter.MDC_KEY), Instant.now()));
    }
}

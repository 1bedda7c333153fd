package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;
import com.github.dimitryivaniuta.billing.webhooks.domain.SignatureVerdict;
import com.github.dimitryivaniuta.billing.webhooks.domain.Subscription;
import com.github.dimitryivaniuta.billing.webhooks.domain.WebhookAuditRecord;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.GatewayVerification;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.LedgerLookup;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.NotificationParseException;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.RateLimitDecision;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapCharge;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TransitionResult;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.WebhookResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Webhook pipeline for Tap charge notifications.
 *
 * <p>Order of checks:
 * <ol>
 *   <li>Per source address rate limit</li>
 *   <li>Parse the body; verify the {@code hashstring} signature (audit signal only)</li>
 *   <li>Ledger lookup: a notification with a final outcome is answered as a duplicate</li>
 *   <li>Per charge rate limit</li>
 *   <li>Claim the ledger key ({@code INSERT ... ON CONFLICT DO NOTHING}); losers are duplicates</li>
 *   <li>Fetch the charge from Tap; from here on only the fetched charge is trusted</li>
 *   <li>Resolve the subscription and apply the transition</li>
 *   <li>Record the final outcome in the ledger and the audit log</li>
 * </ol>
 *
 * <p>The caller always gets a {@link WebhookResult}; nothing escapes as an exception. Once the key is claimed,
 * any storage or unexpected failure marks it {@code INTERNAL_ERROR}, which a redelivery may re-claim.</p>
 */
@Service
public class TapWebhookProcessor {

    private static final Logger log = LoggerFactory.getLogger(TapWebhookProcessor.class);

    static final String OUTCOME_METRIC = "webhooks.tap.outcome";
    static final String UNKNOWN_SOURCE = "unknown";

    static final String CONFIGURATION_ERROR = "configuration_error";
    static final String VERIFICATION_FAILED = "verification_failed";
    static final String SUBSCRIPTION_NOT_FOUND = "subscription_not_found";
    static final String DUPLICATE = "duplicate";
    static final String INTERNAL_ERROR = "internal_error";

    private final AppProperties properties;
    private final WebhookRateLimiter rateLimiter;
    private final TapNotificationParser parser;
    private final TapSignatureVerifier signatureVerifier;
    private final IdempotencyLedger ledger;
    private final ChargeGateway chargeGateway;
    private final SubscriptionResolver subscriptionResolver;
    private final SubscriptionStateEngine stateEngine;
    private final WebhookAuditLog auditLog;
    private final PayloadDigestService digestService;
    private final MeterRegistry meterRegistry;

    /**
     * Creates the processor.
     */
    public TapWebhookProcessor(
            AppProperties properties,
            WebhookRateLimiter rateLimiter,
            TapNotificationParser parser,
            TapSignatureVerifier signatureVerifier,
            IdempotencyLedger ledger,
            ChargeGateway chargeGateway,
            SubscriptionResolver subscriptionResolver,
            SubscriptionStateEngine stateEngine,
            WebhookAuditLog auditLog,
            PayloadDigestService digestService,
            MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.signatureVerifier = signatureVerifier;
        this.ledger = ledger;
        this.chargeGateway = chargeGateway;
        this.subscriptionResolver = subscriptionResolver;
        this.stateEngine = stateEngine;
        this.auditLog = auditLog;
        this.digestService = digestService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Processes one webhook delivery.
     *
     * @param rawBody       raw request body
     * @param signature     {@code hashstring} header, may be null
     * @param sourceAddress caller address, may be null
     * @param requestId     correlation id, generated when null
     * @return acknowledgement body
     */
    public WebhookResult process(String rawBody, String signature, String sourceAddress, String requestId) {
        Attempt attempt = new Attempt(
                requestId != null ? requestId : UUID.randomUUID().toString(),
                rawBody,
                digestService.digest(rawBody),
                sourceAddress == null || sourceAddress.isBlank() ? UNKNOWN_SOURCE : sourceAddress
        );
        try {
            return handle(attempt, signature);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing Tap webhook. requestId={} chargeId={}",
                    attempt.requestId, attempt.chargeId, e);
            if (attempt.claimed) {
                releaseClaim(attempt, safeError(e));
            }
            auditLog.record(attempt.audit()
                    .verificationResult(INTERNAL_ERROR)
                    .errorDetails(safeError(e))
                    .build());
            return finish(WebhookResult.internalError(), INTERNAL_ERROR);
        }
    }

    private WebhookResult handle(Attempt attempt, String signature) {
        RateLimitDecision sourceDecision = rateLimiter.allowSource(attempt.sourceAddress);
        if (!sourceDecision.allowed()) {
            log.warn("Rate limited webhook source {}", attempt.sourceAddress);
            auditLog.record(attempt.audit().verificationResult(sourceDecision.reason()).build());
            return finish(WebhookResult.throttled(sourceDecision.reason()), sourceDecision.reason());
        }

        String secret = properties.getTap().getSecretKey();
        if (secret == null || secret.isBlank()) {
            log.error("Tap secret key is not configured; webhook ignored. requestId={}", attempt.requestId);
            auditLog.record(attempt.audit().verificationResult(CONFIGURATION_ERROR).build());
            return finish(WebhookResult.ignored(CONFIGURATION_ERROR), CONFIGURATION_ERROR);
        }

        TapNotification notification;
        try {
            notification = parser.parse(attempt.rawBody, signature, attempt.sourceAddress);
        } catch (NotificationParseException e) {
            log.warn("Ignoring Tap webhook: {} ({})", e.getReason(), e.getMessage());
            auditLog.record(attempt.audit().verificationResult(e.getReason()).errorDetails(e.getMessage()).build());
            return finish(WebhookResult.ignored(e.getReason()), e.getReason());
        }

        attempt.verdict = signatureVerifier.verify(notification);

        if (notification.chargeId() == null) {
            log.warn("Ignoring Tap webhook without charge id. requestId={}", attempt.requestId);
            auditLog.record(attempt.audit().verificationResult(NotificationParseException.NO_CHARGE_ID).build());
            return finish(WebhookResult.ignored(NotificationParseException.NO_CHARGE_ID), NotificationParseException.NO_CHARGE_ID);
        }

        String chargeId = notification.chargeId();
        String status = notification.ledgerStatus();
        attempt.chargeId = chargeId;
        attempt.claimedStatus = notification.status();

        LedgerLookup prior = ledger.seen(chargeId, status);
        if (prior.exists()) {
            log.info("Duplicate Tap webhook, already processed. chargeId={} status={} previousResult={}",
                    chargeId, status, prior.priorOutcome());
            auditLog.record(attempt.audit()
                    .verificationResult(DUPLICATE)
                    .processingResult(prior.priorOutcome().wireName())
                    .build());
            return finish(WebhookResult.duplicate(prior.priorOutcome().wireName()), DUPLICATE);
        }

        RateLimitDecision chargeDecision = rateLimiter.allowCharge(chargeId);
        if (!chargeDecision.allowed()) {
            log.info("Charge {} rate limited: {}", chargeId, chargeDecision.reason());
            auditLog.record(attempt.audit().verificationResult(chargeDecision.reason()).build());
            return finish(WebhookResult.throttled(chargeDecision.reason()), chargeDecision.reason());
        }

        if (!ledger.recordPending(notification)) {
            log.info("Duplicate Tap webhook, claimed by another delivery. chargeId={} status={}", chargeId, status);
            auditLog.record(attempt.audit().verificationResult(DUPLICATE).build());
            return finish(WebhookResult.duplicate(null), DUPLICATE);
        }
        attempt.claimed = true;
        attempt.ledgerStatus = status;

        GatewayVerification verification = chargeGateway.verify(chargeId);
        if (!verification.success()) {
            log.error("Tap verification failed for charge {}: {}", chargeId, verification.error());
            ledger.recordFinal(chargeId, status, ProcessingOutcome.VERIFICATION_FAILED, null, null, verification.error());
            auditLog.record(attempt.audit()
                    .verificationResult("tap_verification_failed")
                    .errorDetails(verification.error())
                    .build());
            return finish(WebhookResult.ignored(VERIFICATION_FAILED), VERIFICATION_FAILED);
        }

        TapCharge charge = verification.charge();
        ledger.recordVerified(chargeId, status, verification.rawJson());
        if (notification.status() != null && !notification.status().equals(charge.status())) {
            log.warn("Claimed status {} differs from gateway status {} for charge {}",
                    notification.status(), charge.status(), chargeId);
        }

        Optional<Subscription> resolved = subscriptionResolver.resolve(charge);
        if (resolved.isEmpty()) {
            log.warn("No subscription found for charge {}", chargeId);
            ledger.recordFinal(chargeId, status, ProcessingOutcome.SUBSCRIPTION_NOT_FOUND, null,
                    charge.metadataValue(SubscriptionResolver.USER_ID), null);
            auditLog.record(attempt.audit()
                    .verifiedWithTap(true)
                    .tapStatus(charge.status())
                    .actualAmount(charge.amount())
                    .actualCurrency(charge.currency())
                    .verificationResult(SUBSCRIPTION_NOT_FOUND)
                    .build());
            return finish(WebhookResult.ignored(SUBSCRIPTION_NOT_FOUND), SUBSCRIPTION_NOT_FOUND);
        }

        Subscription subscription = resolved.get();
        TransitionResult result = stateEngine.apply(charge, subscription);
        String wireResult = result.outcome().wireName();

        if (result.outcome().isRetryable()) {
            ledger.recordFinal(chargeId, status, result.outcome(), subscription.getId(), subscription.getUserId(), result.error());
            auditLog.record(attempt.audit()
                    .verifiedWithTap(true)
                    .tapStatus(charge.status())
                    .subscriptionId(subscription.getId())
                    .userId(subscription.getUserId())
                    .verificationResult("verified")
                    .processingResult(wireResult)
                    .errorDetails(result.error())
                    .build());
            log.warn("Tap webhook left retryable. chargeId={} subscription={} result={}",
                    chargeId, subscription.getId(), wireResult);
            return finish(WebhookResult.internalError(), INTERNAL_ERROR);
        }

        ledger.recordFinal(chargeId, status, result.outcome(), subscription.getId(), subscription.getUserId(), result.error());
        auditLog.record(attempt.audit()
                .verifiedWithTap(true)
                .tapStatus(charge.status())
                .expectedAmount(subscription.expectedAmount())
                .actualAmount(charge.amount())
                .actualCurrency(charge.currency())
                .subscriptionId(subscription.getId())
                .userId(subscription.getUserId())
                .verificationResult("verified")
                .processingResult(wireResult)
                .errorDetails(result.error())
                .build());

        log.info("Tap webhook processed. chargeId={} gatewayStatus={} subscription={} result={}",
                chargeId, charge.status(), subscription.getId(), wireResult);
        return finish(WebhookResult.processed(wireResult), wireResult);
    }

    /**
     * Marks a claimed key retryable after an unexpected failure so a redelivery can re-claim it.
     */
    private void releaseClaim(Attempt attempt, String error) {
        try {
            ledger.recordFinal(attempt.chargeId, attempt.ledgerStatus, ProcessingOutcome.INTERNAL_ERROR, null, null, error);
        } catch (RuntimeException e) {
            log.error("Could not release ledger claim. chargeId={} status={}", attempt.chargeId, attempt.ledgerStatus, e);
        }
    }

    private WebhookResult finish(WebhookResult result, String metricTag) {
        meterRegistry.counter(OUTCOME_METRIC, "result", metricTag).increment();
        return result;
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

    /**
     * What is known about the current delivery so far; feeds the audit record.
     */
    private static final class Attempt {
        private final String requestId;
        private final String rawBody;
        private final String payloadDigest;
        private final String sourceAddress;
        private SignatureVerdict verdict;
        private String chargeId;
        private String claimedStatus;
        private String ledgerStatus;
        private boolean claimed;

        private Attempt(String requestId, String rawBody, String payloadDigest, String sourceAddress) {
            this.requestId = requestId;
            this.rawBody = rawBody;
            this.payloadDigest = payloadDigest;
            this.sourceAddress = sourceAddress;
        }

        private WebhookAuditRecord.WebhookAuditRecordBuilder audit() {
            return WebhookAuditRecord.builder()
                    .requestId(requestId)
                    .rawPayload(rawBody)
                    .payloadDigest(payloadDigest)
                    .signatureVerdict(verdict)
                    .tapChargeId(chargeId)
                    .tapStatus(claimedStatus)
                    .ipAddress(sourceAddress);
        }
    }
}

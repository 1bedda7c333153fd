package com.github.dimitryivaniuta.billing.webhooks.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.PaymentRecordStatus;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;
import com.github.dimitryivaniuta.billing.webhooks.domain.Subscription;
import com.github.dimitryivaniuta.billing.webhooks.domain.SubscriptionStatus;
import com.github.dimitryivaniuta.billing.webhooks.repo.DiscountRedemptionRepository;
import com.github.dimitryivaniuta.billing.webhooks.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.billing.webhooks.repo.SubscriptionPaymentRepository;
import com.github.dimitryivaniuta.billing.webhooks.repo.SubscriptionRepository;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapCharge;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TransitionResult;
import com.github.dimitryivaniuta.billing.webhooks.service.events.SubscriptionActivatedEvent;
import com.github.dimitryivaniuta.billing.webhooks.service.events.SubscriptionPaymentFailedEvent;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies a verified charge to a subscription.
 *
 * <p>Each transition runs in one transaction that first locks the subscription row, then re-checks the
 * payment ledger, then writes subscription, payment row and outbox event together. Activation is a single
 * UPDATE so the {@code validate_subscription_activation} trigger sees every verification field at once.</p>
 *
 * <p>The discount redemption is written afterwards in its own transaction; a failure there is logged and
 * never undoes the activation.</p>
 */
@Service
public class SubscriptionStateEngine {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionStateEngine.class);

    static final String DISCOUNT_CODE_ID = "discount_code_id";

    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionPaymentRepository paymentRepository;
    private final DiscountRedemptionRepository discountRedemptionRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final AppProperties.Billing billing;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Creates the engine.
     *
     * @param subscriptionRepository       subscriptions
     * @param paymentRepository            payment rows
     * @param discountRedemptionRepository discount redemptions
     * @param outboxEventRepository        outbox
     * @param objectMapper                 jackson mapper
     * @param properties                   app properties
     * @param transactionManager           transaction manager
     * @param clock                        time source
     */
    public SubscriptionStateEngine(
            SubscriptionRepository subscriptionRepository,
            SubscriptionPaymentRepository paymentRepository,
            DiscountRedemptionRepository discountRedemptionRepository,
            OutboxEventRepository outboxEventRepository,
            ObjectMapper objectMapper,
            AppProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.subscriptionRepository = subscriptionRepository;
        this.paymentRepository = paymentRepository;
        this.discountRedemptionRepository = discountRedemptionRepository;
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
        this.billing = properties.getBilling();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Dispatches on the authoritative charge status.
     *
     * @param charge       verified charge
     * @param subscription resolved subscription
     * @return result; {@code IGNORED} for statuses that carry no transition
     */
    public TransitionResult apply(TapCharge charge, Subscription subscription) {
        if (charge.isCaptured()) {
            return applyCaptured(charge, subscription);
        }
        if (charge.isFailure()) {
            return applyFailed(charge, subscription);
        }
        log.info("Charge {} has status {}; nothing to apply", charge.id(), charge.status());
        return TransitionResult.of(ProcessingOutcome.IGNORED);
    }

    /**
     * Activates (or renews) a subscription from a captured charge.
     *
     * @param charge       verified charge, must be CAPTURED
     * @param subscription resolved subscription
     * @return result
     */
    public TransitionResult applyCaptured(TapCharge charge, Subscription subscription) {
        if (!charge.isCaptured()) {
            return TransitionResult.rejected(ProcessingOutcome.INVALID_STATUS,
                    "Expected CAPTURED, got " + charge.status());
        }

        BigDecimal expected = subscription.expectedAmount();
        if (expected != null && !withinTolerance(charge.amount(), expected)) {
            log.warn("Amount mismatch for charge {}: expected {} got {}", charge.id(), expected, charge.amount());
            return TransitionResult.rejected(ProcessingOutcome.AMOUNT_MISMATCH,
                    "Expected " + expected.toPlainString() + ", got " + charge.amount());
        }

        String expectedCurrency = subscription.getCurrency() != null ? subscription.getCurrency() : billing.getCurrency();
        if (!expectedCurrency.equalsIgnoreCase(charge.currency())) {
            log.warn("Currency mismatch for charge {}: expected {} got {}", charge.id(), expectedCurrency, charge.currency());
            return TransitionResult.rejected(ProcessingOutcome.CURRENCY_MISMATCH,
                    "Expected " + expectedCurrency + ", got " + charge.currency());
        }

        if (paymentRepository.existsByTapChargeIdAndStatus(charge.id(), PaymentRecordStatus.PAID)) {
            return TransitionResult.of(ProcessingOutcome.ALREADY_ACTIVE);
        }

        ProcessingOutcome outcome;
        try {
            outcome = transactionTemplate.execute(tx -> activate(charge, subscription.getId()));
        } catch (DataAccessException | TransactionException | IllegalStateException e) {
            log.error("Activation failed for subscription {} charge {}", subscription.getId(), charge.id(), e);
            return TransitionResult.rejected(ProcessingOutcome.ACTIVATION_FAILED, safeError(e));
        }

        if (outcome == ProcessingOutcome.ACTIVATED) {
            applyDiscount(charge, subscription);
        }
        return TransitionResult.of(outcome);
    }

    /**
     * Records a failed, declined or cancelled charge.
     *
     * <p>A charge that already has a paid row is never downgraded. A cancelled subscription keeps its state;
     * the payment row is still written. A storage failure rolls everything back and yields the retryable
     * {@code INTERNAL_ERROR}, so a redelivery can record the failure later.</p>
     *
     * @param charge       verified charge
     * @param subscription resolved subscription
     * @return result
     */
    public TransitionResult applyFailed(TapCharge charge, Subscription subscription) {
        if (!charge.isFailure()) {
            return TransitionResult.rejected(ProcessingOutcome.INVALID_STATUS,
                    "Expected FAILED, DECLINED or CANCELLED, got " + charge.status());
        }
        try {
            return TransitionResult.of(transactionTemplate.execute(tx -> recordFailure(charge, subscription.getId())));
        } catch (DataAccessException | TransactionException | IllegalStateException e) {
            log.error("Recording {} failed for subscription {} charge {}", charge.status(), subscription.getId(), charge.id(), e);
            return TransitionResult.rejected(ProcessingOutcome.INTERNAL_ERROR, safeError(e));
        }
    }

    private ProcessingOutcome activate(TapCharge charge, String subscriptionId) {
        Subscription locked = subscriptionRepository.lockById(subscriptionId)
                .orElseThrow(() -> new IllegalStateException("Subscription " + subscriptionId + " disappeared"));

        if (paymentRepository.existsByTapChargeIdAndStatus(charge.id(), PaymentRecordStatus.PAID)) {
            return ProcessingOutcome.ALREADY_ACTIVE;
        }

        boolean renewal = locked.isRenewal();
        String userId = locked.getUserId();
        String serviceId = locked.getServiceId();

        Instant now = clock.instant();
        Instant nextBilling = now.atZone(ZoneOffset.UTC).plusMonths(billing.getCycleMonths()).toInstant();

        int updated = subscriptionRepository.activate(subscriptionId, charge.id(), TapCharge.CAPTURED, now, nextBilling,
                SubscriptionStatus.ACTIVE);
        if (updated != 1) {
            throw new IllegalStateException("Subscription " + subscriptionId + " was not updated");
        }

        paymentRepository.upsertPaid(
                UUID.randomUUID().toString(),
                charge.id(),
                subscriptionId,
                userId,
                charge.amount(),
                renewal,
                LocalDate.ofInstant(now, ZoneOffset.UTC),
                LocalDate.ofInstant(nextBilling, ZoneOffset.UTC),
                now,
                toJson(Map.of("tap_status", TapCharge.CAPTURED, "activation_source", "webhook"))
        );

        SubscriptionActivatedEvent event = new SubscriptionActivatedEvent(
                "1",
                UUID.randomUUID().toString(),
                now,
                subscriptionId,
                userId,
                serviceId,
                charge.id(),
                charge.amount(),
                charge.currency(),
                renewal,
                nextBilling
        );
        outboxEventRepository.save(OutboxEvent.forSubscription(subscriptionId, SubscriptionActivatedEvent.TYPE, toJson(event)));

        log.info("Subscription {} activated by charge {} (renewal={}, next billing {})",
                subscriptionId, charge.id(), renewal, nextBilling);
        return ProcessingOutcome.ACTIVATED;
    }

    private ProcessingOutcome recordFailure(TapCharge charge, String subscriptionId) {
        Subscription locked = subscriptionRepository.lockById(subscriptionId)
                .orElseThrow(() -> new IllegalStateException("Subscription " + subscriptionId + " disappeared"));

        if (paymentRepository.existsByTapChargeIdAndStatus(charge.id(), PaymentRecordStatus.PAID)) {
            log.info("Ignoring {} for charge {}: already paid", charge.status(), charge.id());
            return ProcessingOutcome.ALREADY_ACTIVE;
        }

        Instant now = clock.instant();
        String userId = locked.getUserId();
        boolean cancelledSubscription = locked.getStatus() == SubscriptionStatus.CANCELLED;

        if (!cancelledSubscription) {
            subscriptionRepository.markPastDue(subscriptionId, charge.status(), now,
                    SubscriptionStatus.PAST_DUE, SubscriptionStatus.CANCELLED);
        }

        PaymentRecordStatus rowStatus = TapCharge.CANCELLED.equals(charge.status())
                ? PaymentRecordStatus.CANCELLED
                : PaymentRecordStatus.FAILED;
        paymentRepository.upsertFailed(
                UUID.randomUUID().toString(),
                charge.id(),
                subscriptionId,
                userId,
                charge.amount(),
                rowStatus.dbValue(),
                now,
                charge.failureReason()
        );

        if (!cancelledSubscription) {
            SubscriptionPaymentFailedEvent event = new SubscriptionPaymentFailedEvent(
                    "1",
                    UUID.randomUUID().toString(),
                    now,
                    subscriptionId,
                    userId,
                    charge.id(),
                    charge.status(),
                    charge.amount(),
                    charge.failureReason()
            );
            outboxEventRepository.save(OutboxEvent.forSubscription(subscriptionId, SubscriptionPaymentFailedEvent.TYPE, toJson(event)));
        }

        log.info("Recorded {} charge {} for subscription {}", charge.status(), charge.id(), subscriptionId);
        return ProcessingOutcome.FAILED;
    }

    private void applyDiscount(TapCharge charge, Subscription subscription) {
        String discountCodeId = subscription.getDiscountCodeId() != null
                ? subscription.getDiscountCodeId()
                : charge.metadataValue(DISCOUNT_CODE_ID);
        BigDecimal base = subscription.getBasePrice();
        BigDecimal billed = subscription.getBillingAmount();
        if (discountCodeId == null || base == null || billed == null || base.compareTo(billed) <= 0) {
            return;
        }

        Instant now = clock.instant();
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                discountRedemptionRepository.upsert(
                        UUID.randomUUID().toString(),
                        discountCodeId,
                        subscription.getId(),
                        subscription.getUserId(),
                        base,
                        billed,
                        base.subtract(billed),
                        now
                );
                subscriptionRepository.markDiscountApplied(subscription.getId(), discountCodeId);
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Discount redemption failed for subscription {} code {}", subscription.getId(), discountCodeId, e);
        }
    }

    private boolean withinTolerance(BigDecimal actual, BigDecimal expected) {
        return actual != null && actual.subtract(expected).abs().compareTo(billing.getAmountTolerance()) <= 0;
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload", e);
        }
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

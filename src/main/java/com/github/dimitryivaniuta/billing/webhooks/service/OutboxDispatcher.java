package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxStatus;
import com.github.dimitryivaniuta.billing.webhooks.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Relays subscription events from the {@code outbox_events} table to Kafka.
 *
 * <p>Each run locks a batch of due rows, sends them keyed by subscription id and waits for the broker
 * acknowledgement of each one. A failed send is rescheduled with capped exponential backoff until
 * {@code app.outbox.max-attempts}, after which the row is left DEAD for manual replay.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    public static final String EVENT_TYPE_HEADER = "event-type";
    public static final String EVENT_ID_HEADER = "event-id";
    public static final String AGGREGATE_ID_HEADER = "aggregate-id";

    private static final List<String> DUE_STATUSES = List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name());

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties.Outbox settings;
    private final Clock clock;
    private final Map<OutboxStatus, Counter> counters = new EnumMap<>(OutboxStatus.class);

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.settings = properties.getOutbox();
        this.clock = clock;
        for (OutboxStatus s : List.of(OutboxStatus.SENT, OutboxStatus.RETRY, OutboxStatus.DEAD)) {
            counters.put(s, Counter.builder("billing.outbox.published")
                    .tag("status", s.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    /**
     * Publishes one batch of due events.
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public void publishBatch() {
        List<OutboxEvent> due = outboxEventRepository.lockDue(DUE_STATUSES, clock.instant(), settings.getBatchSize());
        if (due.isEmpty()) {
            return;
        }

        Map<OutboxStatus, Integer> tally = new EnumMap<>(OutboxStatus.class);
        for (OutboxEvent event : due) {
            OutboxStatus after = publish(event);
            outboxEventRepository.save(event);
            counters.get(after).increment();
            tally.merge(after, 1, Integer::sum);
            if (Thread.currentThread().isInterrupted()) {
                // rest of the batch stays due for the next run
                break;
            }
        }
        log.info("Outbox batch of {} on {}: {}", due.size(), settings.getBillingEventsTopic(), tally);
    }

    private OutboxStatus publish(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(settings.getBillingEventsTopic(), event.getEventKey(), event.getPayload());
        header(record, EVENT_TYPE_HEADER, event.getEventType());
        header(record, EVENT_ID_HEADER, event.getId());
        header(record, AGGREGATE_ID_HEADER, event.getAggregateId());

        try {
            kafkaTemplate.send(record).get(settings.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            event.markSent(clock.instant());
            return OutboxStatus.SENT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(event, "interrupted");
        } catch (ExecutionException e) {
            return failed(event, describe(e.getCause() != null ? e.getCause() : e));
        } catch (TimeoutException e) {
            return failed(event, "no ack within " + settings.getSendTimeout());
        } catch (RuntimeException e) {
            return failed(event, describe(e));
        }
    }

    private OutboxStatus failed(OutboxEvent event, String error) {
        Duration backoff = backoff(settings.getBaseBackoff(), settings.getMaxBackoff(), event.getAttemptCount() + 1);
        Instant now = clock.instant();
        OutboxStatus after = event.recordFailedAttempt(error, now, backoff, settings.getMaxAttempts());
        if (after == OutboxStatus.DEAD) {
            log.error("Outbox event {} {} for {} is DEAD after {} attempts: {}",
                    event.getId(), event.getEventType(), event.getAggregateId(), event.getAttemptCount(), error);
        } else {
            log.warn("Outbox event {} {} failed (attempt {}), next try at {}: {}",
                    event.getId(), event.getEventType(), event.getAttemptCount(), event.getNextAttemptAt(), error);
        }
        return after;
    }

    /**
     * {@code base * 2^(attempt-1)} capped at {@code max}, then scaled by a random factor in [0.5, 1.5) and
     * clamped back into {@code [base, max]}.
     */
    static Duration backoff(Duration base, Duration max, int attempt) {
        long ceiling = max.toMillis();
        long exponential = base.toMillis() << Math.min(Math.max(0, attempt - 1), 30);
        long capped = exponential < 0 ? ceiling : Math.min(exponential, ceiling);
        long jittered = (long) (capped * (0.5 + ThreadLocalRandom.current().nextDouble()));
        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(jittered, ceiling)));
    }

    private static void header(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return msg.length() > 2000 ? msg.substring(0, 2000) : msg;
    }
}

package com.github.dimitryivaniuta.billing.webhooks.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Application-level configuration properties.
 *
 * <p>Loaded once at startup. Secrets come from the environment (see {@code application.yml}).</p>
 */
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private final Tap tap = new Tap();
    @Valid
    private final RateLimit rateLimit = new RateLimit();
    @Valid
    private final Billing billing = new Billing();
    @Valid
    private final Ledger ledger = new Ledger();
    @Valid
    private final Outbox outbox = new Outbox();

    @Getter
    @Setter
    public static class Tap {
        /**
         * Provider name stored on ledger rows.
         */
        @NotBlank
        private String provider = "tap";

        /**
         * Secret key. Used both as the HMAC key for the {@code hashstring} header
         * and as the bearer credential for the charge retrieval API. Left blank, the service starts but
         * acknowledges every webhook with {@code configuration_error}.
         */
        private String secretKey;

        /**
         * Base URL of the Tap REST API.
         */
        @NotBlank
        private String baseUrl = "https://api.tap.company";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(3);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class RateLimit {
        /**
         * Window for the per source address counter.
         */
        @NotNull
        private Duration ipWindow = Duration.ofSeconds(60);

        /**
         * Max requests per source address within {@link #ipWindow}.
         */
        @Positive
        private int ipMaxRequests = 30;

        /**
         * Minimum spacing between two accepted verifications of the same charge.
         */
        @NotNull
        private Duration chargeThrottle = Duration.ofSeconds(5);

        /**
         * Max accepted verifications of the same charge within {@link #chargeWindow}.
         */
        @Positive
        private int chargeMaxVerifications = 3;

        /**
         * Per charge window, measured from the first hit.
         */
        @NotNull
        private Duration chargeWindow = Duration.ofSeconds(60);

        /**
         * Fixed delay between sweeps that drop expired windows, in milliseconds.
         */
        private long evictionIntervalMs = 60_000L;
    }

    @Getter
    @Setter
    public static class Billing {
        /**
         * Currency every subscription is billed in.
         */
        @NotBlank
        private String currency = "KWD";

        /**
         * Absolute tolerance between the verified charge amount and the expected billing amount.
         */
        @DecimalMin("0")
        private BigDecimal amountTolerance = new BigDecimal("0.01");

        /**
         * Length of one billing cycle in months.
         */
        @Positive
        private int cycleMonths = 1;
    }

    @Getter
    @Setter
    public static class Ledger {
        /**
         * TTL of cached final ledger outcomes.
         */
        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic name for billing events.
         */
        @NotBlank
        private String billingEventsTopic = "billing-events";

        /**
         * Whether the application declares the topic itself.
         */
        private boolean createTopic = true;

        /**
         * Partitions of the declared topic.
         */
        @Positive
        private int topicPartitions = 6;

        /**
         * Replication factor of the declared topic.
         */
        @Positive
        private int topicReplicas = 1;

        /**
         * Retention of the declared topic.
         */
        @NotNull
        private Duration topicRetention = Duration.ofDays(7);

        /**
         * Max number of events per batch.
         */
        @Positive
        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        @Positive
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        @NotNull
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(2);
    }
}

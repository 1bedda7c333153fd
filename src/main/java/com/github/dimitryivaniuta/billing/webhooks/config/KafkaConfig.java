package com.github.dimitryivaniuta.billing.webhooks.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic that subscription events from the outbox are published to.
 *
 * <p>Events are keyed by subscription id, so the partition count bounds consumer parallelism while keeping
 * per-subscription ordering. Turn off with {@code app.outbox.create-topic=false} where topics are provisioned
 * outside the application.</p>
 */
@Configuration
public class KafkaConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.outbox", name = "create-topic", havingValue = "true", matchIfMissing = true)
    public NewTopic billingEventsTopic(AppProperties props) {
        AppProperties.Outbox outbox = props.getOutbox();
        return TopicBuilder.name(outbox.getBillingEventsTopic())
                .partitions(outbox.getTopicPartitions())
                .replicas(outbox.getTopicReplicas())
                .config(TopicConfig.RETENTION_MS_CONFIG, String.valueOf(outbox.getTopicRetention().toMillis()))
                .build();
    }
}

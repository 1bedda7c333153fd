package com.github.dimitryivaniuta.billing.webhooks;

import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxStatus;
import com.github.dimitryivaniuta.billing.webhooks.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.billing.webhooks.service.OutboxDispatcher;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Verifies that the outbox dispatcher publishes pending billing events and marks them SENT (ack-based).
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
class OutboxDispatcherTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("billing")
            .withUsername("billing")
            .withPassword("billing");

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
        r.add("spring.cache.type", () -> "none");
        r.add("spring.kafka.bootstrap-servers", () -> "localhost:0");
        r.add("spring.kafka.admin.auto-create", () -> "false");
        r.add("app.outbox.publish-interval-ms", () -> "9999999"); // avoid background interference
        r.add("app.outbox.max-attempts", () -> "2");
    }

    @MockBean
    KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    OutboxEventRepository repo;

    @Autowired
    OutboxDispatcher dispatcher;

    @Test
    @SuppressWarnings("unchecked")
    void dispatcherMarksSent() {
        OutboxEvent e = OutboxEvent.forSubscription("sub_1", "SubscriptionActivated", "{\"ok\":true}");
        repo.save(e);

        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any())).thenReturn(ok);

        dispatcher.publishBatch();

        OutboxEvent updated = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.SENT, updated.getStatus());
        Assertions.assertNotNull(updated.getSentAt());

        ArgumentCaptor<ProducerRecord<String, String>> record = ArgumentCaptor.forClass(ProducerRecord.class);
        Mockito.verify(kafkaTemplate).send(record.capture());

        Assertions.assertEquals("billing-events", record.getValue().topic());
        Assertions.assertEquals("sub_1", record.getValue().key());
        Assertions.assertEquals("{\"ok\":true}", record.getValue().value());
        Assertions.assertEquals("SubscriptionActivated",
                new String(record.getValue().headers().lastHeader(OutboxDispatcher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));
        Assertions.assertEquals(e.getId(),
                new String(record.getValue().headers().lastHeader(OutboxDispatcher.EVENT_ID_HEADER).value(), StandardCharsets.UTF_8));
    }

    @Test
    void failedSendIsRetriedThenDead() {
        OutboxEvent e = OutboxEvent.forSubscription("sub_2", "SubscriptionPaymentFailed", "{}");
        repo.save(e);

        Mockito.when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        dispatcher.publishBatch();

        OutboxEvent retried = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.RETRY, retried.getStatus());
        Assertions.assertEquals(1, retried.getAttemptCount());
        Assertions.assertNotNull(retried.getNextAttemptAt());

        retried.setNextAttemptAt(retried.getNextAttemptAt().minusSeconds(3600));
        repo.save(retried);

        dispatcher.publishBatch();

        OutboxEvent dead = repo.findById(e.getId()).orElseThrow();
        Assertions.assertEquals(OutboxStatus.DEAD, dead.getStatus());
        Assertions.assertTrue(dead.getLastError().contains("broker down"));
    }
}

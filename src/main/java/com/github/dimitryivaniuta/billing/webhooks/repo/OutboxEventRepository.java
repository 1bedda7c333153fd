package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.OutboxEvent;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Outbox rows written by the subscription state engine in the same transaction as the subscription change.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Oldest events in one of {@code statuses} whose retry time has come, row-locked for the current
     * transaction. Rows already locked by another dispatcher are skipped, not waited for.
     *
     * @param statuses publishable statuses
     * @param now      dispatcher time
     * @param limit    max rows
     * @return locked rows, oldest first
     */
    @Query(value = """
            select *
            from outbox_events
            where status in (:statuses)
              and coalesce(next_attempt_at, created_at) <= :now
            order by created_at
            limit :limit
            for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> lockDue(
            @Param("statuses") Collection<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}

package com.github.dimitryivaniuta.billing.webhooks.repo;

import com.github.dimitryivaniuta.billing.webhooks.domain.WebhookAuditRecord;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for the append-only webhook audit log.
 */
public interface WebhookAuditRepository extends JpaRepository<WebhookAuditRecord, String> {

    List<WebhookAuditRecord> findByTapChargeIdOrderByReceivedAtAsc(String tapChargeId);
}

package com.github.dimitryivaniuta.billing.webhooks.service;

import com.github.dimitryivaniuta.billing.webhooks.domain.WebhookAuditRecord;
import com.github.dimitryivaniuta.billing.webhooks.repo.WebhookAuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only audit trail of webhook attempts.
 *
 * <p>Each record is written in its own transaction so it survives a rollback of the caller. Writing is
 * best-effort: a failure is logged and never changes the webhook response.</p>
 */
@Service
public class WebhookAuditLog {

    private static final Logger log = LoggerFactory.getLogger(WebhookAuditLog.class);

    private final WebhookAuditRepository repository;
    private final TransactionTemplate requiresNew;

    public WebhookAuditLog(WebhookAuditRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void record(WebhookAuditRecord record) {
        try {
            requiresNew.executeWithoutResult(tx -> repository.save(record));
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to write webhook audit record. chargeId={} result={}",
                    record.getTapChargeId(), record.getVerificationResult(), e);
        }
    }
}

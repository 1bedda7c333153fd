package com.github.dimitryivaniuta.billing.webhooks.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;

import com.github.dimitryivaniuta.billing.webhooks.config.AppProperties;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessedEvent;
import com.github.dimitryivaniuta.billing.webhooks.domain.ProcessingOutcome;
import com.github.dimitryivaniuta.billing.webhooks.repo.ProcessedEventRepository;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.CachedLedgerOutcome;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.LedgerLookup;
import com.github.dimitryivaniuta.billing.webhooks.service.dto.TapNotification;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class IdempotencyLedgerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T08:00:00Z");

    private ProcessedEventRepository repository;
    private LedgerCacheService cacheService;
    private IdempotencyLedger ledger;

    @BeforeEach
    void setUp() {
        repository = Mockito.mock(ProcessedEventRepository.class);
        cacheService = Mockito.mock(LedgerCacheService.class);
        ledger = new IdempotencyLedger(repository, cacheService, new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void cachedOutcomeShortCircuitsTheDatabase() {
        Mockito.when(cacheService.get("chg_1", "CAPTURED"))
                .thenReturn(new CachedLedgerOutcome("chg_1", "CAPTURED", ProcessingOutcome.ACTIVATED));

        LedgerLookup lookup = ledger.seen("chg_1", "CAPTURED");

        Assertions.assertTrue(lookup.exists());
        Assertions.assertEquals(ProcessingOutcome.ACTIVATED, lookup.priorOutcome());
        Mockito.verifyNoInteractions(repository);
    }

    @Test
    void processedRowIsReportedAndCached() {
        ProcessedEvent row = row(ProcessingOutcome.AMOUNT_MISMATCH, NOW);
        Mockito.when(repository.findByProviderAndChargeIdAndStatus("tap", "chg_1", "CAPTURED")).thenReturn(Optional.of(row));

        LedgerLookup lookup = ledger.seen("chg_1", "CAPTURED");

        Assertions.assertTrue(lookup.exists());
        Assertions.assertEquals(ProcessingOutcome.AMOUNT_MISMATCH, lookup.priorOutcome());
        Mockito.verify(cacheService).put(new CachedLedgerOutcome("chg_1", "CAPTURED", ProcessingOutcome.AMOUNT_MISMATCH));
    }

    @Test
    void pendingOrRetryableRowsAreNotSeen() {
        Mockito.when(repository.findByProviderAndChargeIdAndStatus("tap", "chg_p", "CAPTURED"))
                .thenReturn(Optional.of(row(null, null)));
        Mockito.when(repository.findByProviderAndChargeIdAndStatus("tap", "chg_v", "CAPTURED"))
                .thenReturn(Optional.of(row(ProcessingOutcome.VERIFICATION_FAILED, null)));
        Mockito.when(repository.findByProviderAndChargeIdAndStatus("tap", "chg_e", "CAPTURED"))
                .thenReturn(Optional.of(row(ProcessingOutcome.INTERNAL_ERROR, null)));

        Assertions.assertFalse(ledger.seen("chg_p", "CAPTURED").exists());
        Assertions.assertFalse(ledger.seen("chg_v", "CAPTURED").exists());
        Assertions.assertFalse(ledger.seen("chg_e", "CAPTURED").exists());
        Assertions.assertFalse(ledger.seen("chg_none", "CAPTURED").exists());
        Mockito.verify(cacheService, Mockito.never()).put(any());
    }

    @Test
    void firstInsertClaimsTheKey() {
        Mockito.when(repository.insertIfAbsent(anyString(), eq("tap"), any(), eq("chg_1"), eq("CAPTURED"), anyString(),
                any(), any(), eq(NOW))).thenReturn(1);

        Assertions.assertTrue(ledger.recordPending(notification("CAPTURED")));
        Mockito.verify(repository, Mockito.never()).reclaim(any(), any(), any(), any(), any());
    }

    @Test
    void conflictingInsertIsADuplicate() {
        Mockito.when(repository.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), any(), any())).thenReturn(0);
        Mockito.when(repository.reclaim(any(), any(), any(), any(), any())).thenReturn(0);

        Assertions.assertFalse(ledger.recordPending(notification("CAPTURED")));
    }

    @Test
    void retryableRowIsReclaimed() {
        Mockito.when(repository.insertIfAbsent(any(), any(), any(), any(), any(), any(), any(), any(), any())).thenReturn(0);
        Mockito.when(repository.reclaim("tap", "chg_1", "CAPTURED", "{}", ProcessingOutcome.retryable())).thenReturn(1);

        Assertions.assertTrue(ledger.recordPending(notification("CAPTURED")));
        Assertions.assertTrue(ProcessingOutcome.retryable().contains(ProcessingOutcome.VERIFICATION_FAILED));
        Assertions.assertTrue(ProcessingOutcome.retryable().contains(ProcessingOutcome.INTERNAL_ERROR));
    }

    @Test
    void missingStatusIsKeyedAsUnknown() {
        Mockito.when(repository.insertIfAbsent(any(), any(), any(), any(), eq(TapNotification.UNKNOWN_STATUS), any(),
                any(), any(), any())).thenReturn(1);

        Assertions.assertTrue(ledger.recordPending(notification(null)));
    }

    @Test
    void finalOutcomeIsStampedAndCached() {
        ledger.recordFinal("chg_1", "CAPTURED", ProcessingOutcome.ACTIVATED, "sub_1", "u1", null);

        Mockito.verify(repository).markFinal("tap", "chg_1", "CAPTURED", ProcessingOutcome.ACTIVATED, NOW, "sub_1", "u1", null);
        Mockito.verify(cacheService).put(new CachedLedgerOutcome("chg_1", "CAPTURED", ProcessingOutcome.ACTIVATED));
    }

    @Test
    void retryableOutcomeStaysUnprocessedAndUncached() {
        ledger.recordFinal("chg_1", "CAPTURED", ProcessingOutcome.VERIFICATION_FAILED, null, null, "TAP API: 500");

        Mockito.verify(repository).markFinal(eq("tap"), eq("chg_1"), eq("CAPTURED"),
                eq(ProcessingOutcome.VERIFICATION_FAILED), isNull(), isNull(), isNull(), eq("TAP API: 500"));
        Mockito.verifyNoInteractions(cacheService);
    }

    @Test
    void internalErrorIsRecordedAsRetryable() {
        ledger.recordFinal("chg_1", "CAPTURED", ProcessingOutcome.INTERNAL_ERROR, null, null, "statement timeout");

        Mockito.verify(repository).markFinal(eq("tap"), eq("chg_1"), eq("CAPTURED"),
                eq(ProcessingOutcome.INTERNAL_ERROR), isNull(), isNull(), isNull(), eq("statement timeout"));
        Mockito.verifyNoInteractions(cacheService);
    }

    private static TapNotification notification(String status) {
        return new TapNotification("{}", "sig", "10.0.0.1", "chg_1", status, new BigDecimal("25.000"), "KWD",
                null, null, null, null, Map.of());
    }

    private static ProcessedEvent row(ProcessingOutcome outcome, Instant processedAt) {
        ProcessedEvent e = new ProcessedEvent();
        e.setProcessingResult(outcome);
        e.setProcessedAt(processedAt);
        return e;
    }
}

package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.invariant.InvariantViolationException;
import com.flagship.broker_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Failures inside the processor's transaction come back as results, with
 * the retryable ones marked as such.
 */
class SettlementServiceTest {

    private static final LocalDate PAID_ON = LocalDate.of(2024, 7, 1);

    private SettlementProcessor processor;
    private SimpleMeterRegistry registry;
    private SettlementService service;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        processor = mock(SettlementProcessor.class);
        registry = new SimpleMeterRegistry();
        service = new SettlementService(processor, new LedgerMetrics(registry));
        accountId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Invariant violation is reported, not thrown")
    void invariantViolation() {
        when(processor.process(any())).thenThrow(
            new InvariantViolationException(accountId, List.of("capital 90 differs from expected 100")));

        SettlementResult result = service.settle(accountId, BigDecimal.TEN, PAID_ON, null);

        assertFalse(result.isSuccess());
        assertEquals(SettlementError.Code.INVARIANT_VIOLATION, result.getError().getCode());
        assertFalse(result.getError().isRetryable());
        assertEquals(1.0, registry.counter("ledger.invariant.violations").count());
    }

    @Test
    @DisplayName("Lock timeout is a retryable concurrency conflict")
    void lockTimeout() {
        when(processor.process(any())).thenThrow(new CannotAcquireLockException("lock timeout"));

        SettlementResult result = service.withdrawProfit(accountId, BigDecimal.TEN, PAID_ON, null);

        assertEquals(SettlementError.Code.CONCURRENCY_CONFLICT, result.getError().getCode());
        assertTrue(result.getError().isRetryable());
        assertEquals(1.0, registry.counter("ledger.concurrency.conflicts").count());
    }

    @Test
    @DisplayName("Lost race on the settlement id is a retryable concurrency conflict")
    void duplicateKeyRace() {
        when(processor.process(any())).thenThrow(new DuplicateKeyException("unique_settlement_id"));

        SettlementResult result = service.settle(accountId, BigDecimal.TEN, PAID_ON, "n");

        assertEquals(SettlementError.Code.CONCURRENCY_CONFLICT, result.getError().getCode());
    }

    @Test
    @DisplayName("Every outcome is counted by direction and outcome")
    void outcomeMetrics() {
        when(processor.process(any())).thenReturn(
            SettlementResult.failure(SettlementError.invalidPayment("too much")));

        service.settle(accountId, BigDecimal.TEN, PAID_ON, null);

        assertEquals(1.0, registry.counter("ledger.settlements",
            "direction", "LOSS", "outcome", "INVALID_PAYMENT").count());
    }
}

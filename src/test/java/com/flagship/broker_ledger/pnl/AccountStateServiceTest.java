package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.support.LedgerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccountStateServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 6, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 6, 2);

    private LedgerEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LedgerEngine();
    }

    @Test
    @DisplayName("Drifted caches are rewritten from the ledger and counted")
    void reconcileFixesDrift() {
        UUID accountId = engine.personal("drift-" + UUID.randomUUID(), "10").getId();
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.accounts.refreshCaches(accountId, new BigDecimal("777"), new BigDecimal("1000"));

        AccountState state = engine.stateService.getState(accountId);

        assertEquals(0, state.getCapital().compareTo(new BigDecimal("1000")));
        assertEquals(0, engine.accounts.findById(accountId).get().getCachedCapital()
            .compareTo(new BigDecimal("1000")));
        assertEquals(1.0, engine.meterRegistry.counter("ledger.cache.drift").count());
        assertFalse(engine.stateService.reconcile(accountId));
    }

    @Test
    @DisplayName("Pending summary separates what clients owe from what is owed to them")
    void pendingSummary() {
        UUID loser = engine.company("loser-" + UUID.randomUUID(), "1", "9").getId();
        engine.ledgerService.createFunding(loser, new BigDecimal("100"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(loser, DAY_2, new BigDecimal("5"), null, null);

        UUID winner = engine.personal("winner-" + UUID.randomUUID(), "10").getId();
        engine.ledgerService.createFunding(winner, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(winner, DAY_2, new BigDecimal("1200"), null, null);

        UUID flat = engine.personal("flat-" + UUID.randomUUID(), "10").getId();
        engine.ledgerService.createFunding(flat, new BigDecimal("1000"), DAY_1, null);

        PendingSummary summary = engine.stateService.pendingSummary();

        assertEquals(1, summary.getClientsOwe().size());
        assertEquals(loser, summary.getClientsOwe().get(0).getAccountId());
        assertEquals(new BigDecimal("9.5"), summary.getClientsOwe().get(0).getPending());
        assertEquals(new BigDecimal("0.9"), summary.getClientsOwe().get(0).getMyShare());

        assertEquals(1, summary.getYouOwe().size());
        assertEquals(winner, summary.getYouOwe().get(0).getAccountId());
        assertEquals(new BigDecimal("20.0"), summary.getYouOwe().get(0).getPending());
    }
}

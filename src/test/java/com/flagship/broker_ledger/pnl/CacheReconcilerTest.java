package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.support.LedgerEngine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CacheReconcilerTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 6, 1);

    @Test
    void sweepCorrectsOnlyDriftedAccounts() {
        LedgerEngine engine = new LedgerEngine();
        UUID drifted = engine.personal("sweep-a-" + UUID.randomUUID(), "10").getId();
        UUID clean = engine.personal("sweep-b-" + UUID.randomUUID(), "10").getId();
        engine.ledgerService.createFunding(drifted, new BigDecimal("500"), DAY_1, null);
        engine.ledgerService.createFunding(clean, new BigDecimal("300"), DAY_1, null);
        engine.accounts.refreshCaches(drifted, new BigDecimal("1"), new BigDecimal("1"));

        CacheReconciler reconciler = new CacheReconciler(engine.accounts, engine.stateService);

        assertEquals(1, reconciler.reconcileAll());
        assertEquals(0, engine.accounts.findById(drifted).get().getCachedBalance()
            .compareTo(new BigDecimal("500")));
        assertEquals(0, reconciler.reconcileAll());
    }
}

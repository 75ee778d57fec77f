package com.flagship.broker_ledger.invariant;

import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.ledger.TransactionKind;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import com.flagship.broker_ledger.pnl.BalanceOracle;
import com.flagship.broker_ledger.pnl.CapitalCalculator;
import com.flagship.broker_ledger.pnl.LossProfitResolver;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.LossSnapshot;
import com.flagship.broker_ledger.snapshot.WithdrawalSnapshot;
import com.flagship.broker_ledger.support.InMemoryAccountStore;
import com.flagship.broker_ledger.support.InMemoryLedgerStore;
import com.flagship.broker_ledger.support.InMemorySnapshotStore;
import com.flagship.broker_ledger.support.LedgerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Feeds hand-built, deliberately broken account pictures to the checks.
 */
class InvariantEnforcerTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);

    private InvariantEnforcer enforcer;
    private UUID accountId;
    private List<Transaction> entries;
    private BalanceReference lossReference;

    @BeforeEach
    void setUp() {
        enforcer = new InvariantEnforcer(new InMemoryLedgerStore(), new InMemorySnapshotStore(),
            new InMemoryAccountStore(), new CapitalCalculator(), new BalanceOracle(), new LossProfitResolver());
        accountId = UUID.randomUUID();
        entries = new ArrayList<>();
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        add(Transaction.balanceRecord(accountId, new BigDecimal("100"), null, DAY_2, null));
        lossReference = new BalanceReference(DAY_2, new BigDecimal("100"), 2L);
    }

    private void add(Transaction tx) {
        entries.add(tx.stored(entries.size() + 1, Instant.now()));
    }

    private AccountLedger ledger() {
        return AccountLedger.of(accountId, entries);
    }

    private EpisodeSnapshot openLoss(String amount) {
        return LossSnapshot.open(accountId, lossReference, new BigDecimal(amount), BeneficiarySplit.single(BigDecimal.TEN));
    }

    private InvariantReport check(BigDecimal balance, EpisodeSnapshot... active) {
        InvariantContext.InvariantContextBuilder builder = InvariantContext.builder()
            .ledger(ledger())
            .currentBalance(balance);
        for (EpisodeSnapshot snapshot : active) {
            builder.activeSnapshot(snapshot);
        }
        return enforcer.check(builder.build());
    }

    @Test
    @DisplayName("Tracked loss with matching remaining holds")
    void healthyLoss() {
        InvariantReport report = check(new BigDecimal("100"), openLoss("900"));

        assertTrue(report.isHolding(), () -> report.getViolations().toString());
    }

    @Test
    @DisplayName("Loss without an open episode is a violation")
    void untrackedLoss() {
        InvariantReport report = check(new BigDecimal("100"));

        assertFalse(report.isHolding());
        assertTrue(report.getViolations().get(0).contains("untracked LOSS"));
    }

    @Test
    @DisplayName("Remaining that drifted from the live loss is a violation")
    void remainingDrift() {
        InvariantReport report = check(new BigDecimal("100"), openLoss("850"));

        assertFalse(report.isHolding());
        assertTrue(report.getViolations().stream().anyMatch(v -> v.contains("remaining")));
    }

    @Test
    @DisplayName("Two open episodes are a violation")
    void twoOpenEpisodes() {
        InvariantReport report = check(new BigDecimal("100"), openLoss("900"), openLoss("900"));

        assertTrue(report.getViolations().contains("2 open episodes"));
    }

    @Test
    @DisplayName("Open profit while capital exceeds balance is a violation")
    void directionMismatch() {
        EpisodeSnapshot profit = WithdrawalSnapshot.open(accountId, lossReference, new BigDecimal("900"),
            BeneficiarySplit.single(BigDecimal.TEN));

        InvariantReport report = check(new BigDecimal("100"), profit);

        assertTrue(report.getViolations().stream().anyMatch(v -> v.startsWith("open profit")));
    }

    @Test
    @DisplayName("Settlement whose shares do not add up is a violation")
    void unbalancedSettlementShares() {
        EpisodeSnapshot loss = openLoss("900");
        entries.add(new Transaction(UUID.randomUUID(), accountId, 3L, DAY_2, TransactionKind.SETTLEMENT,
            new BigDecimal("10"), null, new BigDecimal("100.00"), new BigDecimal("60.00"), new BigDecimal("30.00"),
            UUID.randomUUID(), loss.getId(), null, Instant.now()));

        InvariantReport report = check(new BigDecimal("100"), loss);

        assertTrue(report.getViolations().stream().anyMatch(v -> v.contains("do not match capital closed")));
    }

    @Test
    @DisplayName("Capital is compared within one cent")
    void capitalTolerance() {
        InvariantReport holding = enforcer.check(InvariantContext.builder()
            .ledger(ledger())
            .activeSnapshot(openLoss("900"))
            .currentBalance(new BigDecimal("100"))
            .expectedCapital(new BigDecimal("1000.01"))
            .build());
        assertTrue(holding.isHolding(), () -> holding.getViolations().toString());

        InvariantReport broken = enforcer.check(InvariantContext.builder()
            .ledger(ledger())
            .activeSnapshot(openLoss("900"))
            .currentBalance(new BigDecimal("100"))
            .expectedCapital(new BigDecimal("990"))
            .build());
        assertEquals(1, broken.getViolations().size());
    }

    @Test
    @DisplayName("Caches are rewritten only after the checks pass")
    void cacheIsWriteThrough() {
        LedgerEngine engine = new LedgerEngine();
        UUID id = engine.personal("cache-" + UUID.randomUUID(), "10").getId();
        engine.ledgerService.createFunding(id, new BigDecimal("1000"), DAY_1, null);
        engine.accounts.refreshCaches(id, new BigDecimal("777"), new BigDecimal("777"));

        assertThrows(InvariantViolationException.class,
            () -> engine.invariantEnforcer.enforce(id, new BigDecimal("5")));
        assertEquals(0, engine.accounts.findById(id).get().getCachedCapital().compareTo(new BigDecimal("777")));

        engine.invariantEnforcer.enforce(id, new BigDecimal("1000"));
        assertEquals(0, engine.accounts.findById(id).get().getCachedCapital().compareTo(new BigDecimal("1000")));
        assertEquals(0, engine.accounts.findById(id).get().getCachedBalance().compareTo(new BigDecimal("1000")));
    }
}

package com.flagship.broker_ledger.ledger;

import com.flagship.broker_ledger.account.AccountNotFoundException;
import com.flagship.broker_ledger.pnl.AccountState;
import com.flagship.broker_ledger.pnl.EpisodeState;
import com.flagship.broker_ledger.support.LedgerEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Funding and balance records: what they may change and what they must not.
 */
class LedgerServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 2, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 2, 2);
    private static final LocalDate DAY_3 = LocalDate.of(2024, 2, 3);

    private LedgerEngine engine;
    private UUID accountId;

    @BeforeEach
    void setUp() {
        engine = new LedgerEngine();
        accountId = engine.personal("client-" + UUID.randomUUID(), "10").getId();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @Test
    @DisplayName("Funding raises capital and balance together")
    void fundingKeepsAccountNeutral() {
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createFunding(accountId, new BigDecimal("500"), DAY_2, null);

        AccountState state = engine.stateService.getState(accountId);
        assertEquals(EpisodeState.NEUTRAL, state.getState());
        assertEquals(0, state.getCapital().compareTo(new BigDecimal("1500")));
        assertEquals(0, state.getCurrentBalance().compareTo(new BigDecimal("1500")));

        assertEquals(0, engine.accounts.findById(accountId).get().getCachedCapital()
            .compareTo(new BigDecimal("1500")));
    }

    @Test
    @DisplayName("Funding is blocked while a loss is open")
    void fundingBlockedDuringLoss() {
        printTestHeader("Funding Blocked During Loss");
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(accountId, DAY_2, new BigDecimal("100"), null, null);
        int entriesBefore = engine.ledgerService.getTransactions(accountId).size();

        FundingBlockedException e = assertThrows(FundingBlockedException.class,
            () -> engine.ledgerService.createFunding(accountId, new BigDecimal("50"), DAY_3, null));
        printExpectedException("FundingBlockedException", e.getMessage());

        assertEquals(entriesBefore, engine.ledgerService.getTransactions(accountId).size());
    }

    @Test
    @DisplayName("Funding during an open profit moves capital and balance by the same amount")
    void fundingAllowedDuringProfit() {
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(accountId, DAY_2, new BigDecimal("1200"), null, null);

        engine.ledgerService.createFunding(accountId, new BigDecimal("100"), DAY_3, null);

        AccountState state = engine.stateService.getState(accountId);
        assertEquals(EpisodeState.PROFIT, state.getState());
        assertEquals(0, state.getCapital().compareTo(new BigDecimal("1100")));
        assertEquals(0, state.getCurrentBalance().compareTo(new BigDecimal("1300")));
        assertEquals(0, state.getRemainingProfit().compareTo(new BigDecimal("200")));
    }

    @Test
    @DisplayName("Funding dated before an open profit's balance date is rejected as invalid input")
    void backdatedFundingDuringProfit() {
        printTestHeader("Backdated Funding During Profit");
        LocalDate balanceDay = LocalDate.of(2024, 2, 10);
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(accountId, balanceDay, new BigDecimal("1200"), null, null);
        int entriesBefore = engine.ledgerService.getTransactions(accountId).size();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> engine.ledgerService.createFunding(accountId, new BigDecimal("100"), LocalDate.of(2024, 2, 5), null));
        printExpectedException("IllegalArgumentException", e.getMessage());

        assertEquals(entriesBefore, engine.ledgerService.getTransactions(accountId).size());
        AccountState state = engine.stateService.getState(accountId);
        assertEquals(EpisodeState.PROFIT, state.getState());
        assertEquals(0, state.getRemainingProfit().compareTo(new BigDecimal("200")));

        // Same day as the balance record still counts as after it
        engine.ledgerService.createFunding(accountId, new BigDecimal("100"), balanceDay, null);
        AccountState funded = engine.stateService.getState(accountId);
        assertEquals(0, funded.getCapital().compareTo(new BigDecimal("1100")));
        assertEquals(0, funded.getCurrentBalance().compareTo(new BigDecimal("1300")));
    }

    @Test
    @DisplayName("Balance record below capital opens a loss episode with an audit entry")
    void balanceRecordOpensLoss() {
        engine.ledgerService.createFunding(accountId, new BigDecimal("1000"), DAY_1, null);
        engine.ledgerService.createBalanceRecord(accountId, DAY_2, new BigDecimal("80"),
            new BigDecimal("20"), "statement");

        List<Transaction> entries = engine.ledgerService.getTransactions(accountId);
        assertEquals(TransactionKind.LOSS, entries.get(entries.size() - 1).getKind());
        assertEquals(0, entries.get(entries.size() - 1).getAmount().compareTo(new BigDecimal("900")));
        assertEquals(1, engine.ledgerService.getSnapshots(accountId).size());
    }

    @Test
    @DisplayName("Non-positive amounts are rejected before anything is written")
    void invalidAmounts() {
        assertThrows(IllegalArgumentException.class,
            () -> engine.ledgerService.createFunding(accountId, BigDecimal.ZERO, DAY_1, null));
        assertThrows(IllegalArgumentException.class,
            () -> engine.ledgerService.createBalanceRecord(accountId, DAY_1, new BigDecimal("-5"), null, null));

        assertTrue(engine.ledgerService.getTransactions(accountId).isEmpty());
    }

    @Test
    @DisplayName("Unknown account is reported as not found")
    void unknownAccount() {
        UUID unknown = UUID.randomUUID();

        assertThrows(AccountNotFoundException.class,
            () -> engine.ledgerService.createFunding(unknown, BigDecimal.TEN, DAY_1, null));
        assertThrows(AccountNotFoundException.class, () -> engine.ledgerService.getTransactions(unknown));
    }
}

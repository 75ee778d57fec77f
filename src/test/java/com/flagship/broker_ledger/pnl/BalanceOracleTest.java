package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.LossSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BalanceOracleTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 3, 2);
    private static final LocalDate DAY_3 = LocalDate.of(2024, 3, 3);

    private final BalanceOracle oracle = new BalanceOracle();
    private final CapitalCalculator capitalCalculator = new CapitalCalculator();
    private final UUID accountId = UUID.randomUUID();
    private final List<Transaction> entries = new ArrayList<>();

    private Transaction add(Transaction tx) {
        Transaction stored = tx.stored(entries.size() + 1, Instant.now());
        entries.add(stored);
        return stored;
    }

    private AccountLedger ledger() {
        return AccountLedger.of(accountId, entries);
    }

    @Test
    @DisplayName("Empty ledger has zero balance and zero capital")
    void emptyLedger() {
        assertEquals(0, oracle.currentBalance(ledger(), Optional.empty()).signum());
        assertEquals(0, capitalCalculator.capital(ledger()).signum());
    }

    @Test
    @DisplayName("Without a balance record the account is worth its funding")
    void fundingOnly() {
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        add(Transaction.funding(accountId, new BigDecimal("250"), DAY_2, null));

        assertEquals(new BigDecimal("1250"), oracle.currentBalance(ledger(), Optional.empty()));
    }

    @Test
    @DisplayName("Latest balance record plus later funding")
    void recordPlusLaterFunding() {
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        add(Transaction.balanceRecord(accountId, new BigDecimal("800"), new BigDecimal("-20"), DAY_2, null));
        add(Transaction.funding(accountId, new BigDecimal("100"), DAY_3, null));

        assertEquals(new BigDecimal("880"), oracle.currentBalance(ledger(), Optional.empty()));
    }

    @Test
    @DisplayName("Funding on the record's own date counts only if entered after it")
    void sameDayOrderingBySequence() {
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        add(Transaction.funding(accountId, new BigDecimal("50"), DAY_2, null));
        add(Transaction.balanceRecord(accountId, new BigDecimal("900"), null, DAY_2, null));
        add(Transaction.funding(accountId, new BigDecimal("30"), DAY_2, null));

        assertEquals(new BigDecimal("930"), oracle.currentBalance(ledger(), Optional.empty()));
    }

    @Test
    @DisplayName("Backdated balance record does not displace a later one")
    void latestByDateNotBySequence() {
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        add(Transaction.balanceRecord(accountId, new BigDecimal("700"), null, DAY_3, null));
        add(Transaction.balanceRecord(accountId, new BigDecimal("400"), null, DAY_2, null));

        assertEquals(new BigDecimal("700"), oracle.currentBalance(ledger(), Optional.empty()));
    }

    @Test
    @DisplayName("Open episode freezes the reference; newer records are ignored")
    void frozenReference() {
        add(Transaction.funding(accountId, new BigDecimal("1000"), DAY_1, null));
        Transaction record = add(Transaction.balanceRecord(accountId, new BigDecimal("100"), null, DAY_2, null));
        EpisodeSnapshot snapshot = LossSnapshot.open(accountId,
            new BalanceReference(DAY_2, new BigDecimal("100"), record.getSequenceNumber()),
            new BigDecimal("900"), BeneficiarySplit.single(BigDecimal.TEN));
        add(Transaction.balanceRecord(accountId, new BigDecimal("5000"), null, DAY_3, null));

        assertEquals(new BigDecimal("100"), oracle.currentBalance(ledger(), Optional.of(snapshot)));
        assertEquals(new BigDecimal("5000"), oracle.currentBalance(ledger(), Optional.empty()));
    }
}

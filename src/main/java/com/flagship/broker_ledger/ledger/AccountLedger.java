package com.flagship.broker_ledger.ledger;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every ledger entry of one account, in sequence order.
 *
 * Loaded inside the account lock, so it is a consistent picture of the
 * account at that moment. All derived values are computed from it.
 */
public final class AccountLedger {

    private static final Comparator<Transaction> LEDGER_ORDER =
        Comparator.comparing(Transaction::getDate)
            .thenComparing(tx -> tx.getSequenceNumber() != null ? tx.getSequenceNumber() : Long.MAX_VALUE);

    private final UUID accountId;
    private final List<Transaction> transactions;

    private AccountLedger(UUID accountId, List<Transaction> transactions) {
        this.accountId = accountId;
        this.transactions = transactions;
    }

    public static AccountLedger of(UUID accountId, List<Transaction> transactions) {
        List<Transaction> ordered = transactions.stream()
            .sorted(Comparator.comparing(Transaction::getSequenceNumber))
            .toList();
        return new AccountLedger(accountId, ordered);
    }

    public UUID getAccountId() {
        return accountId;
    }

    public List<Transaction> getTransactions() {
        return transactions;
    }

    public BigDecimal totalFunding() {
        return transactions.stream()
            .filter(Transaction::isFunding)
            .map(Transaction::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCapitalClosed() {
        return transactions.stream()
            .filter(Transaction::isSettlement)
            .map(Transaction::getCapitalClosed)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<Transaction> settlements() {
        return transactions.stream()
            .filter(Transaction::isSettlement)
            .toList();
    }

    /**
     * Settlements booked against one snapshot, in the order they committed.
     */
    public List<Transaction> settlementsFor(UUID snapshotId) {
        return transactions.stream()
            .filter(Transaction::isSettlement)
            .filter(tx -> snapshotId.equals(tx.getSnapshotId()))
            .toList();
    }

    public Optional<Transaction> findBySettlementId(UUID settlementId) {
        return transactions.stream()
            .filter(tx -> settlementId.equals(tx.getSettlementId()))
            .findFirst();
    }

    /**
     * Most recent BALANCE_RECORD by date, ties broken by sequence.
     */
    public Optional<Transaction> latestBalanceRecord() {
        return transactions.stream()
            .filter(Transaction::isBalanceRecord)
            .max(LEDGER_ORDER);
    }

    /**
     * Sum of FUNDING entered after the reference.
     */
    public BigDecimal fundingAfter(BalanceReference reference) {
        return transactions.stream()
            .filter(Transaction::isFunding)
            .filter(reference::precedes)
            .map(Transaction::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Where the live (unfrozen) balance currently comes from: the latest
     * balance record, or, before any balance was recorded, the funding
     * given so far.
     */
    public Optional<BalanceReference> currentReference() {
        Optional<Transaction> latestRecord = latestBalanceRecord();
        if (latestRecord.isPresent()) {
            Transaction record = latestRecord.get();
            return Optional.of(new BalanceReference(
                record.getDate(), record.recordedBalance(), record.getSequenceNumber()));
        }
        return transactions.stream()
            .filter(Transaction::isFunding)
            .max(LEDGER_ORDER)
            .map(last -> new BalanceReference(last.getDate(), totalFunding(), last.getSequenceNumber()));
    }
}

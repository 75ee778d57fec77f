package com.flagship.broker_ledger.ledger;

import com.flagship.broker_ledger.money.ShareSplit;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger entry.
 *
 * Never updated or deleted once written; the storage layer rejects both.
 * Sequence number and creation time are assigned by storage, so entries
 * built by the factories below carry {@code null} for them until appended.
 *
 * capitalClosed is signed: positive when a loss payment closes capital,
 * negative when a profit payout books profit into capital.
 */
@Value
public class Transaction {
    UUID id;
    UUID accountId;
    Long sequenceNumber;
    LocalDate date;
    TransactionKind kind;
    BigDecimal amount;
    BigDecimal adjustment;
    BigDecimal capitalClosed;
    BigDecimal yourShareAmount;
    BigDecimal counterpartyShareAmount;
    UUID settlementId;
    UUID snapshotId;
    String note;
    Instant createdAt;

    public static Transaction funding(UUID accountId, BigDecimal amount, LocalDate date, String note) {
        requirePositive(amount, "Funding amount");
        return new Transaction(UUID.randomUUID(), Objects.requireNonNull(accountId), null,
            Objects.requireNonNull(date), TransactionKind.FUNDING, amount,
            null, null, null, null, null, null, note, null);
    }

    public static Transaction balanceRecord(UUID accountId, BigDecimal balance, BigDecimal adjustment,
                                            LocalDate date, String note) {
        requirePositive(balance, "Recorded balance");
        return new Transaction(UUID.randomUUID(), Objects.requireNonNull(accountId), null,
            Objects.requireNonNull(date), TransactionKind.BALANCE_RECORD, balance,
            adjustment != null ? adjustment : BigDecimal.ZERO,
            null, null, null, null, null, note, null);
    }

    /**
     * Settlement entry. The allocation must add up to the capital closed.
     */
    public static Transaction settlement(UUID accountId, LocalDate date, BigDecimal paymentAmount,
                                         BigDecimal capitalClosed, ShareSplit allocation,
                                         UUID settlementId, UUID snapshotId, String note) {
        if (paymentAmount == null || paymentAmount.signum() < 0) {
            throw new IllegalArgumentException("Settlement amount cannot be negative: " + paymentAmount);
        }
        Objects.requireNonNull(capitalClosed, "capitalClosed");
        Objects.requireNonNull(settlementId, "settlementId");
        if (!allocation.isBalanced() || allocation.getTotal().compareTo(capitalClosed) != 0) {
            throw new IllegalArgumentException(String.format(
                "Settlement allocation %s + %s does not match capital closed %s",
                allocation.getMyAmount(), allocation.getCounterpartyAmount(), capitalClosed));
        }
        return new Transaction(UUID.randomUUID(), Objects.requireNonNull(accountId), null,
            Objects.requireNonNull(date), TransactionKind.SETTLEMENT, paymentAmount,
            null, capitalClosed, allocation.getMyAmount(), allocation.getCounterpartyAmount(),
            settlementId, snapshotId, note, null);
    }

    /**
     * LOSS or PROFIT audit entry written when an episode opens.
     */
    public static Transaction episodeAudit(UUID accountId, TransactionKind kind, BigDecimal amount,
                                           LocalDate date, UUID snapshotId, String note) {
        if (!kind.isAuditOnly()) {
            throw new IllegalArgumentException("Not an audit kind: " + kind);
        }
        return new Transaction(UUID.randomUUID(), Objects.requireNonNull(accountId), null,
            Objects.requireNonNull(date), kind, amount,
            null, null, null, null, null, snapshotId, note, null);
    }

    /**
     * Copy carrying the values storage assigned on insert.
     */
    public Transaction stored(long sequenceNumber, Instant createdAt) {
        return new Transaction(id, accountId, sequenceNumber, date, kind, amount, adjustment,
            capitalClosed, yourShareAmount, counterpartyShareAmount, settlementId, snapshotId,
            note, createdAt);
    }

    public boolean isFunding() {
        return kind == TransactionKind.FUNDING;
    }

    public boolean isSettlement() {
        return kind == TransactionKind.SETTLEMENT;
    }

    public boolean isBalanceRecord() {
        return kind == TransactionKind.BALANCE_RECORD;
    }

    /**
     * Balance a BALANCE_RECORD establishes: recorded value plus adjustment.
     */
    public BigDecimal recordedBalance() {
        if (!isBalanceRecord()) {
            throw new IllegalStateException("Not a balance record: " + kind);
        }
        return adjustment != null ? amount.add(adjustment) : amount;
    }

    private static void requirePositive(BigDecimal amount, String label) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException(label + " must be positive");
        }
    }
}

package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.money.BeneficiarySplit;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A frozen loss or profit episode.
 *
 * Everything on a snapshot is immutable except the settled flag, which only
 * ever goes from false to true. What is left to settle is never stored; it
 * is derived from the settlements booked against the snapshot.
 */
public interface EpisodeSnapshot {

    UUID getId();

    UUID getAccountId();

    EpisodeDirection getDirection();

    /**
     * Balance at the moment the episode opened. Current balance during the
     * episode is this plus later funding.
     */
    BalanceReference getBalanceReference();

    /**
     * Loss or profit amount at freeze time.
     */
    BigDecimal getOriginalAmount();

    BeneficiarySplit getSplit();

    boolean isSettled();

    Instant getCreatedAt();

    Instant getSettledAt();

    /**
     * original - sum(|capital_closed|) of the settlements booked against this snapshot.
     */
    default BigDecimal remaining(AccountLedger ledger) {
        BigDecimal closed = ledger.settlementsFor(getId()).stream()
            .map(Transaction::getCapitalClosed)
            .map(BigDecimal::abs)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return getOriginalAmount().subtract(closed);
    }

    /**
     * Remaining right after the given settlement, used to replay an outcome.
     */
    default BigDecimal remainingAfter(AccountLedger ledger, long sequenceNumber) {
        BigDecimal closed = ledger.settlementsFor(getId()).stream()
            .filter(tx -> tx.getSequenceNumber() <= sequenceNumber)
            .map(Transaction::getCapitalClosed)
            .map(BigDecimal::abs)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return getOriginalAmount().subtract(closed);
    }

    boolean isActive();
}

package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A booked settlement.
 *
 * capitalClosed is signed as stored: positive for a loss payment, negative
 * for a profit payout. newRemaining is capital-space, pendingNew share-space
 * (rounded down to one place).
 */
@Value
@Builder
public class SettlementOutcome {
    UUID settlementId;
    UUID transactionId;
    UUID snapshotId;
    EpisodeDirection direction;
    BigDecimal paymentAmount;
    BigDecimal capitalClosed;
    BigDecimal newRemaining;
    BigDecimal pendingNew;
    BigDecimal yourShareAmount;
    BigDecimal counterpartyShareAmount;
    boolean settled;
    /**
     * True when this settlement had already been booked by an identical
     * earlier request and nothing new was written.
     */
    boolean duplicate;
}

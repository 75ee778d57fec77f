package com.flagship.broker_ledger.pnl;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Derived view of one account. Nothing here is stored; every figure comes
 * from the ledger and the open snapshot.
 *
 * pending and the two pending shares are share-space (rounded down to one
 * place). Everything else is capital-space.
 */
@Value
@Builder
public class AccountState {
    UUID accountId;
    String clientName;
    String exchangeName;
    BigDecimal capital;
    BigDecimal currentBalance;
    BigDecimal loss;
    BigDecimal profit;
    BigDecimal remainingLoss;
    BigDecimal remainingProfit;
    BigDecimal pending;
    BigDecimal myPendingShare;
    BigDecimal counterpartyPendingShare;
    EpisodeState state;
    UUID activeSnapshotId;
}

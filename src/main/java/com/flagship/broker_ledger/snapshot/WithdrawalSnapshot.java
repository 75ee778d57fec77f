package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Frozen profit episode, the mirror of {@link LossSnapshot}. Payouts against
 * it book the profit into capital.
 */
@Value
public class WithdrawalSnapshot implements EpisodeSnapshot {
    UUID id;
    UUID accountId;
    BalanceReference balanceReference;
    BigDecimal profitAmount;
    BeneficiarySplit split;
    boolean settled;
    Instant createdAt;
    Instant settledAt;

    public static WithdrawalSnapshot open(UUID accountId, BalanceReference reference,
                                          BigDecimal profitAmount, BeneficiarySplit split) {
        if (profitAmount == null || profitAmount.signum() <= 0) {
            throw new IllegalArgumentException("Profit amount must be positive: " + profitAmount);
        }
        return new WithdrawalSnapshot(UUID.randomUUID(), Objects.requireNonNull(accountId),
            Objects.requireNonNull(reference), profitAmount, Objects.requireNonNull(split),
            false, Instant.now(), null);
    }

    @Override
    public EpisodeDirection getDirection() {
        return EpisodeDirection.PROFIT;
    }

    @Override
    public BigDecimal getOriginalAmount() {
        return profitAmount;
    }

    @Override
    public boolean isActive() {
        return !settled;
    }
}

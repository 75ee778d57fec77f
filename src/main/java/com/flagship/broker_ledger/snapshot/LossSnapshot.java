package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Frozen loss episode. The loss amount, the balance reference and the share
 * split are fixed when the account first shows the loss.
 */
@Value
public class LossSnapshot implements EpisodeSnapshot {
    UUID id;
    UUID accountId;
    BalanceReference balanceReference;
    BigDecimal lossAmount;
    BeneficiarySplit split;
    boolean settled;
    Instant createdAt;
    Instant settledAt;

    public static LossSnapshot open(UUID accountId, BalanceReference reference,
                                    BigDecimal lossAmount, BeneficiarySplit split) {
        if (lossAmount == null || lossAmount.signum() <= 0) {
            throw new IllegalArgumentException("Loss amount must be positive: " + lossAmount);
        }
        return new LossSnapshot(UUID.randomUUID(), Objects.requireNonNull(accountId),
            Objects.requireNonNull(reference), lossAmount, Objects.requireNonNull(split),
            false, Instant.now(), null);
    }

    @Override
    public EpisodeDirection getDirection() {
        return EpisodeDirection.LOSS;
    }

    @Override
    public BigDecimal getOriginalAmount() {
        return lossAmount;
    }

    @Override
    public boolean isActive() {
        return !settled;
    }
}

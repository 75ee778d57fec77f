package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.money.MoneyRounding;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Loss or profit of an account at one instant. At most one of the two is
 * non-zero.
 */
@Value
public class PnlClassification {
    EpisodeState state;
    BigDecimal amount;

    public static PnlClassification neutral() {
        return new PnlClassification(EpisodeState.NEUTRAL, BigDecimal.ZERO);
    }

    public BigDecimal getLoss() {
        return state == EpisodeState.LOSS ? amount : BigDecimal.ZERO;
    }

    public BigDecimal getProfit() {
        return state == EpisodeState.PROFIT ? amount : BigDecimal.ZERO;
    }

    /**
     * A loss or profit under one cent. Closed to zero by an explicit
     * settlement entry, never by opening an episode.
     */
    public boolean isResidual() {
        return state != EpisodeState.NEUTRAL && MoneyRounding.isBelowThreshold(amount);
    }
}

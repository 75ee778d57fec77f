package com.flagship.broker_ledger.pnl;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * LOSS = max(capital - balance, 0), PROFIT = max(balance - capital, 0).
 */
@Component
public class LossProfitResolver {

    public PnlClassification classify(BigDecimal capital, BigDecimal currentBalance) {
        BigDecimal difference = capital.subtract(currentBalance);
        return switch (difference.signum()) {
            case 1 -> new PnlClassification(EpisodeState.LOSS, difference);
            case -1 -> new PnlClassification(EpisodeState.PROFIT, difference.negate());
            default -> PnlClassification.neutral();
        };
    }
}

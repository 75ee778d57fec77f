package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A payment against an open episode: a client paying its share of a loss,
 * or a payout of the shares of a profit.
 */
@Value
public class SettlementCommand {
    UUID accountId;
    EpisodeDirection direction;
    BigDecimal amount;
    LocalDate paymentDate;
    String note;

    public static SettlementCommand lossPayment(UUID accountId, BigDecimal amount, LocalDate paymentDate, String note) {
        return new SettlementCommand(accountId, EpisodeDirection.LOSS, amount, paymentDate, note);
    }

    public static SettlementCommand profitPayout(UUID accountId, BigDecimal amount, LocalDate paymentDate, String note) {
        return new SettlementCommand(accountId, EpisodeDirection.PROFIT, amount, paymentDate, note);
    }
}

package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.money.MoneyRounding;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Turns a payment into the capital it closes.
 *
 * <pre>
 * pending       = remaining x total% / 100
 * capitalClosed = payment x 100 / total%
 * </pre>
 *
 * All validation runs on exact values. capitalClosed is rounded half-up to
 * cents only afterwards, except for a payment of exactly the pending amount,
 * which closes exactly what remains. A remainder under one cent is absorbed
 * into the payment and the episode is settled. A zero payment is accepted
 * once the pending amount shows as 0.0, and closes whatever capital is left
 * behind it.
 *
 * No I/O; the caller supplies the snapshot and what remains on it.
 */
@Component
public class SettlementCalculator {

    public SettlementPlan plan(BigDecimal payment, LocalDate paymentDate,
                               EpisodeSnapshot snapshot, BigDecimal remaining) {
        if (paymentDate.isBefore(snapshot.getBalanceReference().getDate())) {
            throw new SettlementRejectedException(SettlementError.invalidPayment(
                "Payment date " + paymentDate + " precedes the episode's balance date "
                    + snapshot.getBalanceReference().getDate()));
        }
        if (payment.signum() < 0) {
            throw new SettlementRejectedException(SettlementError.invalidPayment(
                "Payment cannot be negative: " + payment));
        }

        BigDecimal totalPct = snapshot.getSplit().totalPct();
        BigDecimal pendingRaw = MoneyRounding.percentOf(remaining, totalPct);

        if (payment.signum() == 0) {
            // Zero equals the pending amount once pending rounds down to 0.0
            if (MoneyRounding.roundShare(pendingRaw).signum() != 0) {
                throw new SettlementRejectedException(SettlementError.invalidPayment(
                    "Payment must be positive while " + MoneyRounding.roundShare(pendingRaw) + " is pending"));
            }
            return new SettlementPlan(remaining, BigDecimal.ZERO, MoneyRounding.roundShare(BigDecimal.ZERO), true);
        }

        if (payment.compareTo(pendingRaw) > 0) {
            throw new SettlementRejectedException(SettlementError.invalidPayment(
                "Payment " + payment + " exceeds pending " + pendingRaw.stripTrailingZeros().toPlainString()));
        }

        BigDecimal capitalRaw = MoneyRounding.capitalFor(payment, totalPct);
        if (capitalRaw.compareTo(remaining) > 0) {
            throw new SettlementRejectedException(SettlementError.capitalExceeded(
                "Capital closed " + capitalRaw + " exceeds remaining " + remaining));
        }

        BigDecimal capitalClosed = capitalRaw.compareTo(remaining) == 0
            ? remaining
            : MoneyRounding.roundCapital(capitalRaw);
        BigDecimal newRemaining = remaining.subtract(capitalClosed);
        if (newRemaining.signum() < 0) {
            throw new SettlementRejectedException(SettlementError.capitalExceeded(
                "Rounded capital closed " + capitalClosed + " exceeds remaining " + remaining));
        }

        boolean settled = false;
        if (MoneyRounding.isBelowThreshold(newRemaining)) {
            capitalClosed = capitalClosed.add(newRemaining);
            newRemaining = BigDecimal.ZERO;
            settled = true;
        }

        BigDecimal pendingNew = MoneyRounding.roundShare(MoneyRounding.percentOf(newRemaining, totalPct));
        return new SettlementPlan(capitalClosed, newRemaining, pendingNew, settled);
    }
}

package com.flagship.broker_ledger.money;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Splits money between two beneficiaries without rounding leakage.
 *
 * Only one side is ever rounded; the other side is the remainder. Rounding
 * both sides independently lets the sum fall short of the total, which must
 * never happen.
 */
@Component
public class ShareSplitter {

    /**
     * Share-space split of a capital-space base (a loss or a profit).
     *
     * total payable = round_down(base x (a + b) / 100)
     * my amount     = round_down(base x a / 100)
     * counterparty  = total payable - my amount (not rounded)
     *
     * Example: base 95, 1% / 9% gives 9.5 = 0.9 + 8.6.
     *
     * @param base capital-space amount, must not be negative
     * @param myPct my share percentage
     * @param counterpartyPct counterparty share percentage
     * @return split whose parts add up to the payable total exactly
     */
    public ShareSplit split(BigDecimal base, BigDecimal myPct, BigDecimal counterpartyPct) {
        if (base.signum() < 0) {
            throw new IllegalArgumentException("Cannot split a negative amount: " + base);
        }
        BigDecimal totalPct = myPct.add(counterpartyPct);
        if (totalPct.signum() <= 0) {
            throw new IllegalArgumentException("Invalid share percentage: total must be > 0");
        }

        BigDecimal totalPayable = MoneyRounding.roundShare(MoneyRounding.percentOf(base, totalPct));
        BigDecimal myAmount = MoneyRounding.roundShare(MoneyRounding.percentOf(base, myPct));
        BigDecimal counterpartyAmount = totalPayable.subtract(myAmount);

        return new ShareSplit(totalPayable, myAmount, counterpartyAmount);
    }

    public ShareSplit split(BigDecimal base, BeneficiarySplit beneficiaries) {
        return split(base, beneficiaries.getMySharePct(), beneficiaries.getCounterpartySharePct());
    }

    /**
     * Capital-space allocation of an amount that is already fixed, e.g. the
     * capital closed by one settlement. The first beneficiary gets its
     * proportion truncated to cents; the counterparty gets the rest.
     *
     * @param total non-negative amount to allocate
     * @param beneficiaries frozen split
     * @return allocation whose parts add up to {@code total} exactly
     */
    public ShareSplit allocate(BigDecimal total, BeneficiarySplit beneficiaries) {
        if (total.signum() < 0) {
            throw new IllegalArgumentException("Cannot allocate a negative amount: " + total);
        }
        if (beneficiaries.getType() == BeneficiarySplit.SplitType.SINGLE) {
            return new ShareSplit(total, total, BigDecimal.ZERO);
        }

        BigDecimal totalPct = beneficiaries.totalPct();
        BigDecimal myRaw = total.multiply(beneficiaries.getMySharePct())
            .divide(totalPct, MoneyRounding.EXACT);
        BigDecimal myAmount = MoneyRounding.truncateCapital(myRaw);
        BigDecimal counterpartyAmount = total.subtract(myAmount);

        return new ShareSplit(total, myAmount, counterpartyAmount);
    }
}

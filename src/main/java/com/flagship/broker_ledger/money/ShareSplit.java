package com.flagship.broker_ledger.money;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of splitting an amount between two beneficiaries.
 *
 * Invariant: myAmount + counterpartyAmount == total, exactly.
 */
@Value
public class ShareSplit {
    BigDecimal total;
    BigDecimal myAmount;
    BigDecimal counterpartyAmount;

    public boolean isBalanced() {
        return myAmount.add(counterpartyAmount).compareTo(total) == 0;
    }

    public ShareSplit negate() {
        return new ShareSplit(total.negate(), myAmount.negate(), counterpartyAmount.negate());
    }
}

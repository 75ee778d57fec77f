package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.TransactionKind;

/**
 * Which side of capital an episode is on.
 */
public enum EpisodeDirection {
    /**
     * Balance fell below capital. The client owes the shares of the loss.
     */
    LOSS,

    /**
     * Balance rose above capital. The shares of the profit are paid out.
     */
    PROFIT;

    /**
     * Audit entry written when an episode of this direction opens.
     */
    public TransactionKind auditKind() {
        return this == LOSS ? TransactionKind.LOSS : TransactionKind.PROFIT;
    }

    /**
     * Sign applied to capital_closed: a loss payment closes capital,
     * a profit payout books profit into it.
     */
    public int capitalSign() {
        return this == LOSS ? 1 : -1;
    }
}

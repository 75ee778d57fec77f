package com.flagship.broker_ledger.ledger;

/**
 * Kind of ledger entry.
 *
 * Only FUNDING, SETTLEMENT and BALANCE_RECORD drive calculations.
 * LOSS and PROFIT are audit entries written when an episode opens.
 */
public enum TransactionKind {
    /**
     * Real money given to the client. Raises capital.
     */
    FUNDING,

    /**
     * Payment against an open episode. Carries the capital it closes.
     */
    SETTLEMENT,

    /**
     * Observed exchange balance on a date.
     */
    BALANCE_RECORD,

    LOSS,

    PROFIT;

    public boolean isAuditOnly() {
        return this == LOSS || this == PROFIT;
    }
}

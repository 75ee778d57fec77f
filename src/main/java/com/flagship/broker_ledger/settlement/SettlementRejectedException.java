package com.flagship.broker_ledger.settlement;

/**
 * A settlement request failed validation. Raised before anything is
 * written and turned into a failed {@link SettlementResult}.
 */
public class SettlementRejectedException extends RuntimeException {

    private final SettlementError error;

    public SettlementRejectedException(SettlementError error) {
        super(error.getMessage());
        this.error = error;
    }

    public SettlementError getError() {
        return error;
    }
}

package com.flagship.broker_ledger.settlement;

import lombok.Value;

/**
 * Either a booked (or replayed) settlement, or the reason it was refused.
 */
@Value
public class SettlementResult {
    SettlementOutcome outcome;
    SettlementError error;

    public static SettlementResult success(SettlementOutcome outcome) {
        return new SettlementResult(outcome, null);
    }

    public static SettlementResult failure(SettlementError error) {
        return new SettlementResult(null, error);
    }

    public static SettlementResult failure(SettlementError.Code code, String message) {
        return failure(new SettlementError(code, message));
    }

    public boolean isSuccess() {
        return outcome != null;
    }
}

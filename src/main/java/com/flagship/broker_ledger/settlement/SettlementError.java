package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import lombok.Value;

/**
 * Why a settlement was not booked.
 */
@Value
public class SettlementError {

    public enum Code {
        NO_ACTIVE_LOSS,
        NO_ACTIVE_PROFIT,
        INVALID_PAYMENT,
        CAPITAL_EXCEEDED,
        INVARIANT_VIOLATION,
        /**
         * Lock timeout or a uniqueness race. Safe to retry with the same
         * request: settlement ids are deterministic.
         */
        CONCURRENCY_CONFLICT,
        ACCOUNT_NOT_FOUND
    }

    Code code;
    String message;

    public boolean isRetryable() {
        return code == Code.CONCURRENCY_CONFLICT;
    }

    public static SettlementError noActiveEpisode(EpisodeDirection direction) {
        return direction == EpisodeDirection.LOSS
            ? new SettlementError(Code.NO_ACTIVE_LOSS, "No active loss to settle")
            : new SettlementError(Code.NO_ACTIVE_PROFIT, "No active profit to withdraw");
    }

    public static SettlementError invalidPayment(String message) {
        return new SettlementError(Code.INVALID_PAYMENT, message);
    }

    public static SettlementError capitalExceeded(String message) {
        return new SettlementError(Code.CAPITAL_EXCEEDED, message);
    }
}

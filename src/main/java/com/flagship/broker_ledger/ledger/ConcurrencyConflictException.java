package com.flagship.broker_ledger.ledger;

/**
 * Another writer held the account, or won a uniqueness race. The request
 * can be retried as is.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

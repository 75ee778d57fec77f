package com.flagship.broker_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A point in the ledger where the exchange balance was known: the date, the
 * balance, and the ledger sequence of the entry that established it.
 *
 * Funding entered after the reference moves the balance forward.
 */
@Value
public class BalanceReference {
    LocalDate date;
    BigDecimal balance;
    long sequenceNumber;

    /**
     * True when {@code tx} sits after this reference in ledger order:
     * a later date, or the same date with a later sequence.
     */
    public boolean precedes(Transaction tx) {
        int byDate = tx.getDate().compareTo(date);
        if (byDate != 0) {
            return byDate > 0;
        }
        return tx.getSequenceNumber() != null && tx.getSequenceNumber() > sequenceNumber;
    }
}

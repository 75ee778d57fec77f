package com.flagship.broker_ledger.ledger;

import java.util.UUID;

/**
 * Append-only store of ledger transactions.
 *
 * There is deliberately no update or delete.
 */
public interface LedgerStore {

    /**
     * Appends an entry and returns it with the sequence number and
     * creation time assigned by storage.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the settlement id is already taken
     */
    Transaction append(Transaction transaction);

    /**
     * Loads every entry of an account, in sequence order.
     */
    AccountLedger loadLedger(UUID accountId);
}

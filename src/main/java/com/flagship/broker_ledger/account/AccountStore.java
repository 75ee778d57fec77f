package com.flagship.broker_ledger.account;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for client exchange accounts.
 */
public interface AccountStore {

    void insert(ClientExchangeAccount account);

    Optional<ClientExchangeAccount> findById(UUID accountId);

    List<ClientExchangeAccount> findAll();

    /**
     * Takes the exclusive account lock for the rest of the current
     * transaction and returns the locked row.
     *
     * @throws org.springframework.dao.PessimisticLockingFailureException if the lock is not granted in time
     */
    Optional<ClientExchangeAccount> lockForUpdate(UUID accountId);

    void updateDefaultShares(UUID accountId, BigDecimal mySharePct, BigDecimal companySharePct);

    /**
     * Overwrites the read caches with values derived from the ledger.
     */
    void refreshCaches(UUID accountId, BigDecimal capital, BigDecimal balance);
}

package com.flagship.broker_ledger.support;

import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Account store backed by a map. Locking is a no-op: the engine tests are
 * single threaded.
 */
public class InMemoryAccountStore implements AccountStore {

    private final Map<UUID, ClientExchangeAccount> accounts = new LinkedHashMap<>();

    @Override
    public void insert(ClientExchangeAccount account) {
        boolean taken = accounts.values().stream().anyMatch(existing ->
            existing.getClientName().equals(account.getClientName())
                && existing.getExchangeName().equals(account.getExchangeName()));
        if (taken) {
            throw new DuplicateKeyException("unique_client_exchange");
        }
        accounts.put(account.getId(), account);
    }

    @Override
    public Optional<ClientExchangeAccount> findById(UUID accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    @Override
    public List<ClientExchangeAccount> findAll() {
        return new ArrayList<>(accounts.values());
    }

    @Override
    public Optional<ClientExchangeAccount> lockForUpdate(UUID accountId) {
        return findById(accountId);
    }

    @Override
    public void updateDefaultShares(UUID accountId, BigDecimal mySharePct, BigDecimal companySharePct) {
        ClientExchangeAccount account = accounts.get(accountId);
        accounts.put(accountId, account.withShares(mySharePct, companySharePct));
    }

    @Override
    public void refreshCaches(UUID accountId, BigDecimal capital, BigDecimal balance) {
        ClientExchangeAccount a = accounts.get(accountId);
        accounts.put(accountId, new ClientExchangeAccount(a.getId(), a.getClientName(), a.getExchangeName(),
            a.getClientType(), a.getMySharePct(), a.getCompanySharePct(), capital, balance,
            Instant.now(), a.getCreatedAt()));
    }
}

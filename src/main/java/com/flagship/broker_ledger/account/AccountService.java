package com.flagship.broker_ledger.account;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Creates client exchange accounts and maintains their default shares.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountStore accountStore;

    /**
     * @throws IllegalArgumentException if the shares do not suit the client type
     * @throws org.springframework.dao.DuplicateKeyException if the client already has an account on the exchange
     */
    @Transactional
    public ClientExchangeAccount createAccount(String clientName, String exchangeName, ClientType clientType,
                                               BigDecimal mySharePct, BigDecimal companySharePct) {
        if (clientName == null || clientName.isBlank() || exchangeName == null || exchangeName.isBlank()) {
            throw new IllegalArgumentException("Client and exchange names are required");
        }
        ClientExchangeAccount account = ClientExchangeAccount.create(clientName.trim(), exchangeName.trim(),
            clientType, mySharePct, companySharePct);
        accountStore.insert(account);

        log.info("Account created: accountId={}, client={}, exchange={}, type={}",
            account.getId(), account.getClientName(), account.getExchangeName(), clientType);
        return account;
    }

    /**
     * Changes the shares future snapshots will freeze. An open episode keeps
     * its own split.
     */
    @Transactional
    public ClientExchangeAccount updateDefaultShares(UUID accountId, BigDecimal mySharePct,
                                                     BigDecimal companySharePct) {
        ClientExchangeAccount updated = accountStore.lockForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId))
            .withShares(mySharePct, companySharePct);
        accountStore.updateDefaultShares(accountId, updated.getMySharePct(), updated.getCompanySharePct());

        log.info("Default shares changed: accountId={}, my={}, company={}",
            accountId, updated.getMySharePct(), updated.getCompanySharePct());
        return updated;
    }

    @Transactional(readOnly = true)
    public ClientExchangeAccount getAccount(UUID accountId) {
        return accountStore.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public List<ClientExchangeAccount> listAccounts() {
        return accountStore.findAll();
    }
}

package com.flagship.broker_ledger.account;

import com.flagship.broker_ledger.money.BeneficiarySplit;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One client trading on one exchange. Aggregate root of the ledger: its row
 * is what gets locked while a mutation runs.
 *
 * The share percentages are defaults. They only matter at the moment a new
 * snapshot is frozen; an open episode keeps the split it was frozen with.
 *
 * cachedCapital and cachedBalance are read caches. The ledger is the source
 * of truth and the caches are refreshed after every mutation.
 */
@Value
public class ClientExchangeAccount {
    UUID id;
    String clientName;
    String exchangeName;
    ClientType clientType;
    BigDecimal mySharePct;
    BigDecimal companySharePct;
    BigDecimal cachedCapital;
    BigDecimal cachedBalance;
    Instant cacheRefreshedAt;
    Instant createdAt;

    public static ClientExchangeAccount create(String clientName, String exchangeName, ClientType clientType,
                                               BigDecimal mySharePct, BigDecimal companySharePct) {
        validateShares(clientType, mySharePct, companySharePct);
        return new ClientExchangeAccount(UUID.randomUUID(), clientName, exchangeName, clientType,
            mySharePct, companySharePct != null ? companySharePct : BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO, null, Instant.now());
    }

    /**
     * Split to freeze into a new snapshot.
     */
    public BeneficiarySplit resolveSplit() {
        return switch (clientType) {
            case PERSONAL -> BeneficiarySplit.single(mySharePct);
            case COMPANY -> BeneficiarySplit.dual(mySharePct, companySharePct);
        };
    }

    public ClientExchangeAccount withShares(BigDecimal mySharePct, BigDecimal companySharePct) {
        validateShares(clientType, mySharePct, companySharePct);
        return new ClientExchangeAccount(id, clientName, exchangeName, clientType,
            mySharePct, companySharePct != null ? companySharePct : BigDecimal.ZERO,
            cachedCapital, cachedBalance, cacheRefreshedAt, createdAt);
    }

    /**
     * A personal client has no company share; a company client needs a total
     * share in (0, 100].
     */
    static void validateShares(ClientType clientType, BigDecimal mySharePct, BigDecimal companySharePct) {
        if (clientType == null) {
            throw new IllegalArgumentException("Client type is required");
        }
        if (mySharePct == null || mySharePct.signum() < 0 || mySharePct.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("My share must be between 0 and 100: " + mySharePct);
        }
        BigDecimal company = companySharePct != null ? companySharePct : BigDecimal.ZERO;
        if (clientType == ClientType.PERSONAL) {
            if (company.signum() != 0) {
                throw new IllegalArgumentException("A personal client cannot carry a company share");
            }
            if (mySharePct.signum() == 0) {
                throw new IllegalArgumentException("My share must be positive for a personal client");
            }
            return;
        }
        if (company.signum() < 0) {
            throw new IllegalArgumentException("Company share cannot be negative: " + company);
        }
        BigDecimal total = mySharePct.add(company);
        if (total.signum() == 0 || total.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("Total share must be in (0, 100]: " + total);
        }
    }
}

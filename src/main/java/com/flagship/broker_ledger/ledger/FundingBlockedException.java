package com.flagship.broker_ledger.ledger;

import java.util.UUID;

/**
 * Funding was refused because the account has an open loss. The loss must
 * be settled first; funding would otherwise move a frozen balance.
 */
public class FundingBlockedException extends IllegalStateException {

    public FundingBlockedException(UUID accountId, UUID snapshotId) {
        super("Funding blocked: account " + accountId + " has an active loss (snapshot " + snapshotId + ")");
    }
}

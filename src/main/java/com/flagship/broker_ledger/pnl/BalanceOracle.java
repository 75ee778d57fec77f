package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves the current exchange balance (CB) of an account.
 *
 * <pre>
 * CB = reference balance + sum(FUNDING after the reference)
 * </pre>
 *
 * While an episode is open the reference is the one frozen on its snapshot,
 * so new balance records do not move CB until the episode closes. Without
 * an episode it is the latest balance record. An account that never had a
 * balance recorded is worth what it was funded with.
 */
@Component
public class BalanceOracle {

    public BigDecimal currentBalance(AccountLedger ledger, Optional<EpisodeSnapshot> activeSnapshot) {
        return reference(ledger, activeSnapshot)
            .map(reference -> reference.getBalance().add(ledger.fundingAfter(reference)))
            .orElse(BigDecimal.ZERO);
    }

    public Optional<BalanceReference> reference(AccountLedger ledger, Optional<EpisodeSnapshot> activeSnapshot) {
        if (activeSnapshot.isPresent()) {
            return Optional.of(activeSnapshot.get().getBalanceReference());
        }
        return ledger.currentReference();
    }
}

package com.flagship.broker_ledger.invariant;

import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.LedgerStore;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.money.MoneyRounding;
import com.flagship.broker_ledger.pnl.BalanceOracle;
import com.flagship.broker_ledger.pnl.CapitalCalculator;
import com.flagship.broker_ledger.pnl.EpisodeState;
import com.flagship.broker_ledger.pnl.LossProfitResolver;
import com.flagship.broker_ledger.pnl.PnlClassification;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Verifies that an account still adds up after a mutation.
 *
 * Invariants:
 * 1. CAPITAL matches the capital the operation predicted
 * 2. Capital closed never exceeds funding
 * 3. At most one open episode
 * 4. An open loss has CAPITAL >= CB, an open profit CB >= CAPITAL
 * 5. The episode's remaining equals the live difference
 * 6. Every settlement's shares add up to its capital closed
 * 7. No open episode means no loss and no profit
 * 8. Loss and profit are never both positive
 *
 * All comparisons allow 0.01. The account caches are write-through: once
 * the checks pass they are rewritten from the ledger values just verified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvariantEnforcer {

    private final LedgerStore ledgerStore;
    private final SnapshotStore snapshotStore;
    private final AccountStore accountStore;
    private final CapitalCalculator capitalCalculator;
    private final BalanceOracle balanceOracle;
    private final LossProfitResolver resolver;

    /**
     * Re-reads the account inside the current transaction, checks every
     * invariant, then refreshes the caches.
     *
     * @param expectedCapital capital the operation should have produced, or null to skip that check
     * @throws InvariantViolationException if anything does not add up
     */
    public void enforce(UUID accountId, BigDecimal expectedCapital) {
        AccountLedger ledger = ledgerStore.loadLedger(accountId);
        List<EpisodeSnapshot> active = snapshotStore.findActive(accountId);
        BigDecimal capital = capitalCalculator.capital(ledger);
        BigDecimal balance = balanceOracle.currentBalance(ledger, active.stream().findFirst());

        InvariantReport report = check(InvariantContext.builder()
            .ledger(ledger)
            .activeSnapshots(active)
            .currentBalance(balance)
            .expectedCapital(expectedCapital)
            .build());

        if (!report.isHolding()) {
            throw new InvariantViolationException(accountId, report.getViolations());
        }
        accountStore.refreshCaches(accountId, capital, balance);
        log.debug("Invariants hold: capital={}, balance={}, activeEpisodes={}", capital, balance, active.size());
    }

    /**
     * Pure check over an already loaded context.
     */
    public InvariantReport check(InvariantContext context) {
        List<String> violations = new ArrayList<>();
        AccountLedger ledger = context.getLedger();
        BigDecimal capital = capitalCalculator.capital(ledger);
        BigDecimal balance = context.getCurrentBalance();

        if (context.getExpectedCapital() != null
                && !MoneyRounding.withinTolerance(capital, context.getExpectedCapital())) {
            violations.add("capital " + capital + " differs from expected " + context.getExpectedCapital());
        }

        if (ledger.totalCapitalClosed().compareTo(ledger.totalFunding()) > 0) {
            violations.add("capital closed " + ledger.totalCapitalClosed()
                + " exceeds funding " + ledger.totalFunding());
        }

        for (Transaction settlement : ledger.settlements()) {
            BigDecimal shares = settlement.getYourShareAmount().add(settlement.getCounterpartyShareAmount());
            if (!MoneyRounding.withinTolerance(shares, settlement.getCapitalClosed())) {
                violations.add("settlement " + settlement.getSettlementId() + " shares " + shares
                    + " do not match capital closed " + settlement.getCapitalClosed());
            }
        }

        BigDecimal loss = capital.subtract(balance).max(BigDecimal.ZERO);
        BigDecimal profit = balance.subtract(capital).max(BigDecimal.ZERO);
        if (loss.signum() > 0 && profit.signum() > 0) {
            violations.add("loss " + loss + " and profit " + profit + " are both positive");
        }

        List<EpisodeSnapshot> active = context.getActiveSnapshots();
        if (active.size() > 1) {
            violations.add(active.size() + " open episodes");
        }

        if (active.isEmpty()) {
            PnlClassification classification = resolver.classify(capital, balance);
            if (classification.getState() != EpisodeState.NEUTRAL) {
                violations.add("untracked " + classification.getState() + " of " + classification.getAmount());
            }
        } else {
            for (EpisodeSnapshot snapshot : active) {
                checkEpisode(snapshot, ledger, capital, balance, violations);
            }
        }

        return new InvariantReport(violations);
    }

    private void checkEpisode(EpisodeSnapshot snapshot, AccountLedger ledger, BigDecimal capital,
                              BigDecimal balance, List<String> violations) {
        boolean loss = snapshot.getDirection() == EpisodeDirection.LOSS;
        if (loss && capital.compareTo(balance) < 0) {
            violations.add("open loss " + snapshot.getId() + " but capital " + capital + " < balance " + balance);
        }
        if (!loss && balance.compareTo(capital) < 0) {
            violations.add("open profit " + snapshot.getId() + " but balance " + balance + " < capital " + capital);
        }

        BigDecimal live = (loss ? capital.subtract(balance) : balance.subtract(capital)).max(BigDecimal.ZERO);
        BigDecimal remaining = snapshot.remaining(ledger);
        if (!MoneyRounding.withinTolerance(remaining, live)) {
            violations.add("episode " + snapshot.getId() + " remaining " + remaining
                + " differs from live " + snapshot.getDirection() + " " + live);
        }
    }
}

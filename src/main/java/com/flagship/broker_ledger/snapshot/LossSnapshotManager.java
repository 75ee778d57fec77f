package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.event.EpisodeOpenedEvent;
import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.ledger.LedgerStore;
import com.flagship.broker_ledger.ledger.SettlementKeys;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import com.flagship.broker_ledger.money.ShareSplit;
import com.flagship.broker_ledger.money.ShareSplitter;
import com.flagship.broker_ledger.observability.LedgerMetrics;
import com.flagship.broker_ledger.outbox.OutboxService;
import com.flagship.broker_ledger.pnl.BalanceOracle;
import com.flagship.broker_ledger.pnl.CapitalCalculator;
import com.flagship.broker_ledger.pnl.EpisodeState;
import com.flagship.broker_ledger.pnl.LossProfitResolver;
import com.flagship.broker_ledger.pnl.PnlClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Opens loss and profit episodes.
 *
 * Runs inside the account lock after every mutation. When the account has
 * no open episode and shows a loss (or a profit) of at least one cent, the
 * loss amount, the balance reference and the share split are frozen into a
 * new snapshot. A sub-cent difference is closed instead, by a zero-amount
 * settlement whose capital_closed absorbs it.
 *
 * Settling an episode is the settlement processor's job; this class only
 * decides whether a new one starts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LossSnapshotManager {

    private static final String RESIDUAL_NOTE = "Auto-close residual below 0.01";

    private final LedgerStore ledgerStore;
    private final SnapshotStore snapshotStore;
    private final CapitalCalculator capitalCalculator;
    private final BalanceOracle balanceOracle;
    private final LossProfitResolver resolver;
    private final ShareSplitter shareSplitter;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Caller must hold the account lock.
     *
     * @param account the locked account
     * @param asOf date stamped on any entry this evaluation appends
     */
    @Transactional
    public EpisodeEvaluation evaluate(ClientExchangeAccount account, LocalDate asOf) {
        UUID accountId = account.getId();
        List<EpisodeSnapshot> active = snapshotStore.findActive(accountId);
        if (!active.isEmpty()) {
            // Balance is frozen while an episode is open
            return EpisodeEvaluation.unchanged();
        }

        AccountLedger ledger = ledgerStore.loadLedger(accountId);
        BigDecimal capital = capitalCalculator.capital(ledger);
        BigDecimal balance = balanceOracle.currentBalance(ledger, Optional.empty());
        PnlClassification classification = resolver.classify(capital, balance);

        if (classification.getState() == EpisodeState.NEUTRAL) {
            return EpisodeEvaluation.unchanged();
        }
        if (classification.isResidual()) {
            return EpisodeEvaluation.residualClosed(closeResidual(account, ledger, capital.subtract(balance), asOf));
        }
        return EpisodeEvaluation.opened(openEpisode(account, ledger, classification, asOf));
    }

    @Transactional(readOnly = true)
    public List<EpisodeSnapshot> history(UUID accountId) {
        return snapshotStore.findByAccount(accountId);
    }

    private Transaction closeResidual(ClientExchangeAccount account, AccountLedger ledger,
                                      BigDecimal signedResidual, LocalDate asOf) {
        ShareSplit allocation = shareSplitter.allocate(signedResidual.abs(), account.resolveSplit());
        if (signedResidual.signum() < 0) {
            allocation = allocation.negate();
        }
        long lastSequence = ledger.getTransactions().get(ledger.getTransactions().size() - 1).getSequenceNumber();
        UUID settlementId = SettlementKeys.forResidual(account.getId(), lastSequence, signedResidual);

        Transaction closure = ledgerStore.append(Transaction.settlement(account.getId(), asOf, BigDecimal.ZERO,
            signedResidual, allocation, settlementId, null, RESIDUAL_NOTE));

        log.info("Closed residual: capitalClosed={}, settlementId={}", signedResidual, settlementId);
        return closure;
    }

    private EpisodeSnapshot openEpisode(ClientExchangeAccount account, AccountLedger ledger,
                                        PnlClassification classification, LocalDate asOf) {
        BalanceReference reference = balanceOracle.reference(ledger, Optional.empty())
            .orElseThrow(() -> new IllegalStateException(
                "Account " + account.getId() + " shows " + classification.getState() + " without a balance reference"));
        BeneficiarySplit split = account.resolveSplit();

        EpisodeSnapshot snapshot = classification.getState() == EpisodeState.LOSS
            ? LossSnapshot.open(account.getId(), reference, classification.getAmount(), split)
            : WithdrawalSnapshot.open(account.getId(), reference, classification.getAmount(), split);

        snapshotStore.insert(snapshot);
        ledgerStore.append(Transaction.episodeAudit(account.getId(), snapshot.getDirection().auditKind(),
            snapshot.getOriginalAmount(), asOf, snapshot.getId(), null));
        outboxService.record(EpisodeOpenedEvent.from(snapshot));
        ledgerMetrics.recordEpisodeOpened(snapshot.getDirection().name());

        log.info("Opened {} episode: snapshotId={}, amount={}, referenceBalance={}, split={}/{}",
            snapshot.getDirection(), snapshot.getId(), snapshot.getOriginalAmount(),
            reference.getBalance(), split.getMySharePct(), split.getCounterpartySharePct());
        return snapshot;
    }
}

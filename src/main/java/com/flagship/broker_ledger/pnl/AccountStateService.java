package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.account.AccountNotFoundException;
import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.LedgerStore;
import com.flagship.broker_ledger.money.MoneyRounding;
import com.flagship.broker_ledger.money.ShareSplit;
import com.flagship.broker_ledger.money.ShareSplitter;
import com.flagship.broker_ledger.observability.LedgerMetrics;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side: account state, pending amounts, cache reconciliation.
 *
 * The cached capital and balance on an account are compared against the
 * ledger on every read. A mismatch is logged and the cache rewritten under
 * the account lock; the answer is always the ledger's.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountStateService {

    private final AccountStore accountStore;
    private final LedgerStore ledgerStore;
    private final SnapshotStore snapshotStore;
    private final CapitalCalculator capitalCalculator;
    private final BalanceOracle balanceOracle;
    private final LossProfitResolver resolver;
    private final ShareSplitter shareSplitter;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public AccountState getState(UUID accountId) {
        ClientExchangeAccount account = accountStore.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        AccountState state = derive(account);

        if (isStale(account, state)) {
            reconcile(accountId);
        }
        return state;
    }

    /**
     * Rewrites the account's caches from the ledger if they drifted.
     *
     * @return true if the caches had to be corrected
     */
    @Transactional
    public boolean reconcile(UUID accountId) {
        ClientExchangeAccount account = accountStore.lockForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        AccountState state = derive(account);
        if (!isStale(account, state)) {
            return false;
        }

        log.warn("Cache drift corrected: accountId={}, cachedCapital={}, capital={}, cachedBalance={}, balance={}",
            accountId, account.getCachedCapital(), state.getCapital(),
            account.getCachedBalance(), state.getCurrentBalance());
        ledgerMetrics.incrementCacheDrift();
        accountStore.refreshCaches(accountId, state.getCapital(), state.getCurrentBalance());
        return true;
    }

    @Transactional(readOnly = true)
    public PendingSummary pendingSummary() {
        List<PendingSummary.Entry> clientsOwe = new ArrayList<>();
        List<PendingSummary.Entry> youOwe = new ArrayList<>();

        for (EpisodeSnapshot snapshot : snapshotStore.findAllActive()) {
            Optional<ClientExchangeAccount> account = accountStore.findById(snapshot.getAccountId());
            if (account.isEmpty()) {
                continue;
            }
            AccountLedger ledger = ledgerStore.loadLedger(snapshot.getAccountId());
            BigDecimal remaining = snapshot.remaining(ledger);
            ShareSplit pending = shareSplitter.split(remaining.max(BigDecimal.ZERO), snapshot.getSplit());

            PendingSummary.Entry entry = new PendingSummary.Entry(
                snapshot.getAccountId(),
                snapshot.getId(),
                account.get().getClientName(),
                account.get().getExchangeName(),
                account.get().getClientType(),
                remaining,
                pending.getTotal(),
                pending.getMyAmount(),
                pending.getCounterpartyAmount());

            if (snapshot.getDirection() == EpisodeDirection.LOSS) {
                clientsOwe.add(entry);
            } else {
                youOwe.add(entry);
            }
        }

        Comparator<PendingSummary.Entry> largestFirst =
            Comparator.comparing(PendingSummary.Entry::getPending).reversed();
        clientsOwe.sort(largestFirst);
        youOwe.sort(largestFirst);
        return PendingSummary.of(clientsOwe, youOwe);
    }

    private AccountState derive(ClientExchangeAccount account) {
        AccountLedger ledger = ledgerStore.loadLedger(account.getId());
        Optional<EpisodeSnapshot> active = snapshotStore.findActiveSnapshot(account.getId());
        BigDecimal capital = capitalCalculator.capital(ledger);
        BigDecimal balance = balanceOracle.currentBalance(ledger, active);
        PnlClassification classification = resolver.classify(capital, balance);

        AccountState.AccountStateBuilder builder = AccountState.builder()
            .accountId(account.getId())
            .clientName(account.getClientName())
            .exchangeName(account.getExchangeName())
            .capital(capital)
            .currentBalance(balance)
            .loss(classification.getLoss())
            .profit(classification.getProfit())
            .remainingLoss(BigDecimal.ZERO)
            .remainingProfit(BigDecimal.ZERO);

        if (active.isEmpty()) {
            BigDecimal none = MoneyRounding.roundShare(BigDecimal.ZERO);
            return builder
                .state(classification.getState())
                .pending(none)
                .myPendingShare(none)
                .counterpartyPendingShare(none)
                .build();
        }

        EpisodeSnapshot snapshot = active.get();
        BigDecimal remaining = snapshot.remaining(ledger);
        ShareSplit pending = shareSplitter.split(remaining.max(BigDecimal.ZERO), snapshot.getSplit());
        if (snapshot.getDirection() == EpisodeDirection.LOSS) {
            builder.state(EpisodeState.LOSS).remainingLoss(remaining);
        } else {
            builder.state(EpisodeState.PROFIT).remainingProfit(remaining);
        }
        return builder
            .activeSnapshotId(snapshot.getId())
            .pending(pending.getTotal())
            .myPendingShare(pending.getMyAmount())
            .counterpartyPendingShare(pending.getCounterpartyAmount())
            .build();
    }

    private static boolean isStale(ClientExchangeAccount account, AccountState state) {
        return account.getCachedCapital() == null
            || account.getCachedBalance() == null
            || account.getCachedCapital().compareTo(state.getCapital()) != 0
            || account.getCachedBalance().compareTo(state.getCurrentBalance()) != 0;
    }
}

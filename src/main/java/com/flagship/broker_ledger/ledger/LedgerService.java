package com.flagship.broker_ledger.ledger;

import com.flagship.broker_ledger.account.AccountNotFoundException;
import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.invariant.InvariantEnforcer;
import com.flagship.broker_ledger.pnl.CapitalCalculator;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import com.flagship.broker_ledger.snapshot.EpisodeEvaluation;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.LossSnapshotManager;
import com.flagship.broker_ledger.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records funding and exchange balances.
 *
 * Each call is one transaction under the account lock: append the entry,
 * let the snapshot manager react (a new balance can open an episode), then
 * check the invariants. A failed check rolls the entry back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccountStore accountStore;
    private final LedgerStore ledgerStore;
    private final SnapshotStore snapshotStore;
    private final CapitalCalculator capitalCalculator;
    private final LossSnapshotManager snapshotManager;
    private final InvariantEnforcer invariantEnforcer;

    /**
     * Real money given to the client. Raises capital, and the balance
     * along with it.
     *
     * @throws FundingBlockedException while a loss is open
     * @throws IllegalArgumentException if the amount is not positive, or if a
     *         profit episode is open and the date precedes its balance date
     */
    @Transactional
    public Transaction createFunding(UUID accountId, BigDecimal amount, LocalDate date, String note) {
        Transaction funding = Transaction.funding(accountId, amount, date, note);
        try {
            ClientExchangeAccount account = lock(accountId);

            Optional<EpisodeSnapshot> active = snapshotStore.findActiveSnapshot(accountId);
            if (active.isPresent() && active.get().getDirection() == EpisodeDirection.LOSS) {
                throw new FundingBlockedException(accountId, active.get().getId());
            }
            if (active.isPresent() && date.isBefore(active.get().getBalanceReference().getDate())) {
                // Would raise capital without moving the frozen balance
                throw new IllegalArgumentException("Funding date " + date + " precedes the open episode's balance date "
                    + active.get().getBalanceReference().getDate());
            }

            BigDecimal capitalBefore = capitalCalculator.capital(ledgerStore.loadLedger(accountId));
            Transaction stored = ledgerStore.append(funding);
            EpisodeEvaluation evaluation = snapshotManager.evaluate(account, date);
            invariantEnforcer.enforce(accountId, capitalBefore.add(amount).subtract(evaluation.capitalClosed()));

            log.info("Funding recorded: accountId={}, amount={}, date={}, sequence={}",
                accountId, amount, date, stored.getSequenceNumber());
            return stored;
        } catch (PessimisticLockingFailureException | DuplicateKeyException e) {
            throw new ConcurrencyConflictException("Account " + accountId + " is busy, retry the request", e);
        }
    }

    /**
     * Observed exchange balance on a date. May open a loss or profit
     * episode. While one is open the balance is frozen and the record only
     * takes effect once the episode closes.
     *
     * @throws IllegalArgumentException if the balance is not positive
     */
    @Transactional
    public Transaction createBalanceRecord(UUID accountId, LocalDate date, BigDecimal balance,
                                           BigDecimal adjustment, String note) {
        Transaction record = Transaction.balanceRecord(accountId, balance, adjustment, date, note);
        try {
            ClientExchangeAccount account = lock(accountId);

            BigDecimal capitalBefore = capitalCalculator.capital(ledgerStore.loadLedger(accountId));
            Transaction stored = ledgerStore.append(record);
            EpisodeEvaluation evaluation = snapshotManager.evaluate(account, date);
            invariantEnforcer.enforce(accountId, capitalBefore.subtract(evaluation.capitalClosed()));

            log.info("Balance recorded: accountId={}, balance={}, adjustment={}, date={}, episode={}",
                accountId, balance, record.getAdjustment(), date, evaluation.getAction());
            return stored;
        } catch (PessimisticLockingFailureException | DuplicateKeyException e) {
            throw new ConcurrencyConflictException("Account " + accountId + " is busy, retry the request", e);
        }
    }

    @Transactional(readOnly = true)
    public List<Transaction> getTransactions(UUID accountId) {
        requireAccount(accountId);
        return ledgerStore.loadLedger(accountId).getTransactions();
    }

    @Transactional(readOnly = true)
    public List<EpisodeSnapshot> getSnapshots(UUID accountId) {
        requireAccount(accountId);
        return snapshotManager.history(accountId);
    }

    private ClientExchangeAccount lock(UUID accountId) {
        return accountStore.lockForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    private void requireAccount(UUID accountId) {
        if (accountStore.findById(accountId).isEmpty()) {
            throw new AccountNotFoundException(accountId);
        }
    }
}

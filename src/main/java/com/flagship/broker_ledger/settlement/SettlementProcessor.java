package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.account.AccountStore;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.event.EpisodeClosedEvent;
import com.flagship.broker_ledger.event.SettlementRecordedEvent;
import com.flagship.broker_ledger.invariant.InvariantEnforcer;
import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.ledger.LedgerStore;
import com.flagship.broker_ledger.ledger.SettlementKeys;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.money.MoneyRounding;
import com.flagship.broker_ledger.money.ShareSplit;
import com.flagship.broker_ledger.money.ShareSplitter;
import com.flagship.broker_ledger.observability.CorrelationContext;
import com.flagship.broker_ledger.observability.LedgerMetrics;
import com.flagship.broker_ledger.outbox.OutboxService;
import com.flagship.broker_ledger.pnl.CapitalCalculator;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import com.flagship.broker_ledger.snapshot.EpisodeEvaluation;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import com.flagship.broker_ledger.snapshot.LossSnapshotManager;
import com.flagship.broker_ledger.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Books one settlement payment, atomically, under the account lock.
 *
 * Steps, all in one transaction:
 * 1. Lock the account row
 * 2. Answer a repeated request from the settlement it already wrote
 * 3. Validate the payment against the open episode and plan its effect
 * 4. Append the SETTLEMENT entry, allocated between the frozen beneficiaries
 * 5. Mark the episode settled if nothing is left on it
 * 6. Let the snapshot manager open the next episode, if the ledger shows one
 * 7. Check every invariant; a failure rolls all of the above back
 * 8. Write the SettlementRecorded (and EpisodeClosed) events to the outbox
 *
 * A rejected request writes nothing. Exceptions (invariant violations,
 * lock timeouts) propagate so the transaction rolls back; the caller turns
 * them into a result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementProcessor {

    private final AccountStore accountStore;
    private final LedgerStore ledgerStore;
    private final SnapshotStore snapshotStore;
    private final CapitalCalculator capitalCalculator;
    private final SettlementCalculator settlementCalculator;
    private final ShareSplitter shareSplitter;
    private final LossSnapshotManager snapshotManager;
    private final InvariantEnforcer invariantEnforcer;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public SettlementResult process(SettlementCommand command) {
        if (command.getAmount() == null || command.getPaymentDate() == null) {
            return SettlementResult.failure(SettlementError.invalidPayment("Payment amount and date are required"));
        }

        UUID accountId = command.getAccountId();
        Optional<ClientExchangeAccount> locked = accountStore.lockForUpdate(accountId);
        if (locked.isEmpty()) {
            return SettlementResult.failure(SettlementError.Code.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
        }
        ClientExchangeAccount account = locked.get();

        AccountLedger ledger = ledgerStore.loadLedger(accountId);
        Optional<EpisodeSnapshot> active = snapshotStore.findActiveSnapshot(accountId);

        Optional<SettlementOutcome> prior = findPriorOutcome(command, ledger, active);
        if (prior.isPresent()) {
            log.info("Settlement already booked, replaying: settlementId={}", prior.get().getSettlementId());
            ledgerMetrics.incrementDuplicates();
            return SettlementResult.success(prior.get());
        }

        Optional<EpisodeSnapshot> episode = active.filter(s -> s.getDirection() == command.getDirection());
        if (episode.isEmpty()) {
            return SettlementResult.failure(SettlementError.noActiveEpisode(command.getDirection()));
        }
        EpisodeSnapshot snapshot = episode.get();

        SettlementPlan plan;
        try {
            plan = settlementCalculator.plan(command.getAmount(), command.getPaymentDate(),
                snapshot, snapshot.remaining(ledger));
        } catch (SettlementRejectedException e) {
            log.info("Settlement rejected: code={}, reason={}", e.getError().getCode(), e.getMessage());
            return SettlementResult.failure(e.getError());
        }

        return book(command, account, ledger, snapshot, plan);
    }

    private SettlementResult book(SettlementCommand command, ClientExchangeAccount account, AccountLedger ledger,
                                  EpisodeSnapshot snapshot, SettlementPlan plan) {
        UUID accountId = account.getId();
        UUID settlementId = settlementIdFor(command, snapshot);
        CorrelationContext.putSettlementId(settlementId);

        BigDecimal capitalBefore = capitalCalculator.capital(ledger);
        ShareSplit allocation = shareSplitter.allocate(plan.getCapitalClosed(), snapshot.getSplit());
        BigDecimal signedClosed = plan.getCapitalClosed();
        if (command.getDirection() == EpisodeDirection.PROFIT) {
            allocation = allocation.negate();
            signedClosed = signedClosed.negate();
        }

        Transaction settlement = ledgerStore.append(Transaction.settlement(accountId, command.getPaymentDate(),
            command.getAmount(), signedClosed, allocation, settlementId, snapshot.getId(), command.getNote()));

        if (plan.isSettled()) {
            snapshotStore.markSettled(snapshot.getId());
            log.info("{} episode settled: snapshotId={}", snapshot.getDirection(), snapshot.getId());
        }

        EpisodeEvaluation evaluation = snapshotManager.evaluate(account, command.getPaymentDate());

        BigDecimal expectedCapital = capitalBefore.subtract(signedClosed).subtract(evaluation.capitalClosed());
        invariantEnforcer.enforce(accountId, expectedCapital);

        SettlementOutcome outcome = SettlementOutcome.builder()
            .settlementId(settlementId)
            .transactionId(settlement.getId())
            .snapshotId(snapshot.getId())
            .direction(snapshot.getDirection())
            .paymentAmount(command.getAmount())
            .capitalClosed(signedClosed)
            .newRemaining(plan.getNewRemaining())
            .pendingNew(plan.getPendingNew())
            .yourShareAmount(allocation.getMyAmount())
            .counterpartyShareAmount(allocation.getCounterpartyAmount())
            .settled(plan.isSettled())
            .duplicate(false)
            .build();
        outboxService.record(SettlementRecordedEvent.from(accountId, outcome, command.getPaymentDate()));
        if (plan.isSettled()) {
            outboxService.record(EpisodeClosedEvent.from(snapshot, settlementId));
            ledgerMetrics.recordEpisodeClosed(snapshot.getDirection().name());
        }

        log.info("Settlement booked: amount={}, capitalClosed={}, newRemaining={}, pendingNew={}, settled={}",
            command.getAmount(), signedClosed, plan.getNewRemaining(), plan.getPendingNew(), plan.isSettled());
        return SettlementResult.success(outcome);
    }

    /**
     * The request is matched against the open episode and against the last
     * settled one of the same direction, so retrying the payment that closed
     * an episode is also recognised.
     */
    private Optional<SettlementOutcome> findPriorOutcome(SettlementCommand command, AccountLedger ledger,
                                                         Optional<EpisodeSnapshot> active) {
        List<EpisodeSnapshot> candidates = new ArrayList<>();
        active.filter(s -> s.getDirection() == command.getDirection()).ifPresent(candidates::add);
        snapshotStore.findLatestSettled(command.getAccountId(), command.getDirection()).ifPresent(candidates::add);

        for (EpisodeSnapshot candidate : candidates) {
            Optional<Transaction> existing = ledger.findBySettlementId(settlementIdFor(command, candidate));
            if (existing.isPresent()) {
                return Optional.of(replay(existing.get(), candidate, ledger));
            }
        }
        return Optional.empty();
    }

    private SettlementOutcome replay(Transaction settlement, EpisodeSnapshot snapshot, AccountLedger ledger) {
        BigDecimal newRemaining = snapshot.remainingAfter(ledger, settlement.getSequenceNumber());
        BigDecimal pendingNew = MoneyRounding.roundShare(
            MoneyRounding.percentOf(newRemaining, snapshot.getSplit().totalPct()));

        return SettlementOutcome.builder()
            .settlementId(settlement.getSettlementId())
            .transactionId(settlement.getId())
            .snapshotId(snapshot.getId())
            .direction(snapshot.getDirection())
            .paymentAmount(settlement.getAmount())
            .capitalClosed(settlement.getCapitalClosed())
            .newRemaining(newRemaining)
            .pendingNew(pendingNew)
            .yourShareAmount(settlement.getYourShareAmount())
            .counterpartyShareAmount(settlement.getCounterpartyShareAmount())
            .settled(newRemaining.signum() == 0)
            .duplicate(true)
            .build();
    }

    private UUID settlementIdFor(SettlementCommand command, EpisodeSnapshot snapshot) {
        return SettlementKeys.forPayment(command.getAccountId(), command.getDirection().name(),
            snapshot.getBalanceReference(), snapshot.getId(), command.getAmount(),
            command.getPaymentDate(), command.getNote());
    }
}

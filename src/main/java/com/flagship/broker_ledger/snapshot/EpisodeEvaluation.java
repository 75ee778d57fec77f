package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * What {@link LossSnapshotManager#evaluate} did to an account.
 */
@Value
public class EpisodeEvaluation {

    public enum Action {
        /**
         * Nothing to do: an episode is already open, or the account is flat.
         */
        UNCHANGED,
        RESIDUAL_CLOSED,
        EPISODE_OPENED
    }

    Action action;
    EpisodeSnapshot openedSnapshot;
    Transaction residualClosure;

    static EpisodeEvaluation unchanged() {
        return new EpisodeEvaluation(Action.UNCHANGED, null, null);
    }

    static EpisodeEvaluation residualClosed(Transaction closure) {
        return new EpisodeEvaluation(Action.RESIDUAL_CLOSED, null, closure);
    }

    static EpisodeEvaluation opened(EpisodeSnapshot snapshot) {
        return new EpisodeEvaluation(Action.EPISODE_OPENED, snapshot, null);
    }

    public Optional<EpisodeSnapshot> getOpened() {
        return Optional.ofNullable(openedSnapshot);
    }

    /**
     * Capital closed by the evaluation itself (only a residual closure
     * closes any).
     */
    public BigDecimal capitalClosed() {
        return residualClosure != null ? residualClosure.getCapitalClosed() : BigDecimal.ZERO;
    }
}

package com.flagship.broker_ledger.snapshot;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for loss and withdrawal snapshots.
 *
 * Storage allows at most one unsettled snapshot per account, whatever its
 * direction; a second insert fails with a DuplicateKeyException.
 */
public interface SnapshotStore {

    void insert(EpisodeSnapshot snapshot);

    /**
     * Every unsettled snapshot of the account. More than one is an
     * invariant violation, but the read does not hide it.
     */
    List<EpisodeSnapshot> findActive(UUID accountId);

    default Optional<EpisodeSnapshot> findActiveSnapshot(UUID accountId) {
        return findActive(accountId).stream().findFirst();
    }

    /**
     * Most recently settled snapshot of one direction.
     */
    Optional<EpisodeSnapshot> findLatestSettled(UUID accountId, EpisodeDirection direction);

    /**
     * Snapshot history of an account, newest first.
     */
    List<EpisodeSnapshot> findByAccount(UUID accountId);

    /**
     * Unsettled snapshots across all accounts.
     */
    List<EpisodeSnapshot> findAllActive();

    /**
     * Flips is_settled from false to true. Nothing else about a snapshot
     * is ever written after insert.
     *
     * @throws IllegalStateException if the snapshot is not active
     */
    void markSettled(UUID snapshotId);
}

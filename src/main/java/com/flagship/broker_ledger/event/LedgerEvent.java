package com.flagship.broker_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact published about an account's ledger. Written to the outbox in the
 * same transaction as the change it describes.
 */
public interface LedgerEvent {

    String AGGREGATE_TYPE = "ClientExchangeAccount";

    /**
     * Unique per event instance, for consumer deduplication.
     */
    UUID getEventId();

    UUID getAccountId();

    Instant getOccurredAt();

    String getEventType();
}

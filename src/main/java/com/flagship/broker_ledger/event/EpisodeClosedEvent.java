package com.flagship.broker_ledger.event;

import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * An episode was fully settled.
 */
@Value
public class EpisodeClosedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID snapshotId;
    String direction;
    BigDecimal originalAmount;
    UUID closingSettlementId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EpisodeClosed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EpisodeClosedEvent from(EpisodeSnapshot snapshot, UUID closingSettlementId) {
        return new EpisodeClosedEvent(
            UUID.randomUUID(),
            snapshot.getAccountId(),
            snapshot.getId(),
            snapshot.getDirection().name(),
            snapshot.getOriginalAmount(),
            closingSettlementId,
            Instant.now()
        );
    }
}

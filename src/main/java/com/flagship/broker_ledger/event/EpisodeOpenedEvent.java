package com.flagship.broker_ledger.event;

import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A loss or profit episode was frozen.
 */
@Value
public class EpisodeOpenedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID snapshotId;
    String direction;
    BigDecimal amount;
    LocalDate referenceDate;
    BigDecimal referenceBalance;
    BigDecimal mySharePct;
    BigDecimal counterpartySharePct;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EpisodeOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static EpisodeOpenedEvent from(EpisodeSnapshot snapshot) {
        return new EpisodeOpenedEvent(
            UUID.randomUUID(),
            snapshot.getAccountId(),
            snapshot.getId(),
            snapshot.getDirection().name(),
            snapshot.getOriginalAmount(),
            snapshot.getBalanceReference().getDate(),
            snapshot.getBalanceReference().getBalance(),
            snapshot.getSplit().getMySharePct(),
            snapshot.getSplit().getCounterpartySharePct(),
            Instant.now()
        );
    }
}

package com.flagship.broker_ledger.event;

import com.flagship.broker_ledger.settlement.SettlementOutcome;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A settlement payment was booked against an episode.
 */
@Value
public class SettlementRecordedEvent implements LedgerEvent {
    UUID eventId;
    UUID accountId;
    UUID settlementId;
    UUID transactionId;
    UUID snapshotId;
    String direction;
    BigDecimal paymentAmount;
    BigDecimal capitalClosed;
    BigDecimal newRemaining;
    BigDecimal yourShareAmount;
    BigDecimal counterpartyShareAmount;
    boolean settled;
    LocalDate paymentDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SettlementRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static SettlementRecordedEvent from(UUID accountId, SettlementOutcome outcome, LocalDate paymentDate) {
        return new SettlementRecordedEvent(
            UUID.randomUUID(),
            accountId,
            outcome.getSettlementId(),
            outcome.getTransactionId(),
            outcome.getSnapshotId(),
            outcome.getDirection().name(),
            outcome.getPaymentAmount(),
            outcome.getCapitalClosed(),
            outcome.getNewRemaining(),
            outcome.getYourShareAmount(),
            outcome.getCounterpartyShareAmount(),
            outcome.isSettled(),
            paymentDate,
            Instant.now()
        );
    }
}

package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.settlement.SettlementOutcome;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("settlement_id")
    UUID settlementId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("snapshot_id")
    UUID snapshotId;

    @JsonProperty("direction")
    EpisodeDirection direction;

    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("capital_closed")
    BigDecimal capitalClosed;

    @JsonProperty("new_remaining")
    BigDecimal newRemaining;

    @JsonProperty("pending_new")
    BigDecimal pendingNew;

    @JsonProperty("your_share_amount")
    BigDecimal yourShareAmount;

    @JsonProperty("counterparty_share_amount")
    BigDecimal counterpartyShareAmount;

    @JsonProperty("settled")
    boolean settled;

    @JsonProperty("duplicate")
    boolean duplicate;

    public static SettlementResponse from(SettlementOutcome outcome) {
        return SettlementResponse.builder()
            .settlementId(outcome.getSettlementId())
            .transactionId(outcome.getTransactionId())
            .snapshotId(outcome.getSnapshotId())
            .direction(outcome.getDirection())
            .paymentAmount(outcome.getPaymentAmount())
            .capitalClosed(outcome.getCapitalClosed())
            .newRemaining(outcome.getNewRemaining())
            .pendingNew(outcome.getPendingNew())
            .yourShareAmount(outcome.getYourShareAmount())
            .counterpartyShareAmount(outcome.getCounterpartyShareAmount())
            .settled(outcome.isSettled())
            .duplicate(outcome.isDuplicate())
            .build();
    }
}

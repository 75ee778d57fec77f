package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("adjustment")
    BigDecimal adjustment;

    @JsonProperty("capital_closed")
    BigDecimal capitalClosed;

    @JsonProperty("your_share_amount")
    BigDecimal yourShareAmount;

    @JsonProperty("counterparty_share_amount")
    BigDecimal counterpartyShareAmount;

    @JsonProperty("settlement_id")
    UUID settlementId;

    @JsonProperty("snapshot_id")
    UUID snapshotId;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(Transaction tx) {
        return TransactionResponse.builder()
            .id(tx.getId())
            .sequenceNumber(tx.getSequenceNumber())
            .date(tx.getDate())
            .kind(tx.getKind())
            .amount(tx.getAmount())
            .adjustment(tx.getAdjustment())
            .capitalClosed(tx.getCapitalClosed())
            .yourShareAmount(tx.getYourShareAmount())
            .counterpartyShareAmount(tx.getCounterpartyShareAmount())
            .settlementId(tx.getSettlementId())
            .snapshotId(tx.getSnapshotId())
            .note(tx.getNote())
            .createdAt(tx.getCreatedAt())
            .build();
    }
}

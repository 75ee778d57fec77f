package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import com.flagship.broker_ledger.snapshot.EpisodeDirection;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class SnapshotResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("direction")
    EpisodeDirection direction;

    @JsonProperty("original_amount")
    BigDecimal originalAmount;

    @JsonProperty("reference_date")
    LocalDate referenceDate;

    @JsonProperty("reference_balance")
    BigDecimal referenceBalance;

    @JsonProperty("split_type")
    BeneficiarySplit.SplitType splitType;

    @JsonProperty("my_share_pct")
    BigDecimal mySharePct;

    @JsonProperty("counterparty_share_pct")
    BigDecimal counterpartySharePct;

    @JsonProperty("is_settled")
    boolean settled;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static SnapshotResponse from(EpisodeSnapshot snapshot) {
        return SnapshotResponse.builder()
            .id(snapshot.getId())
            .direction(snapshot.getDirection())
            .originalAmount(snapshot.getOriginalAmount())
            .referenceDate(snapshot.getBalanceReference().getDate())
            .referenceBalance(snapshot.getBalanceReference().getBalance())
            .splitType(snapshot.getSplit().getType())
            .mySharePct(snapshot.getSplit().getMySharePct())
            .counterpartySharePct(snapshot.getSplit().getCounterpartySharePct())
            .settled(snapshot.isSettled())
            .createdAt(snapshot.getCreatedAt())
            .settledAt(snapshot.getSettledAt())
            .build();
    }
}

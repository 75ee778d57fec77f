package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.pnl.AccountState;
import com.flagship.broker_ledger.pnl.EpisodeState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class AccountStateResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("client_name")
    String clientName;

    @JsonProperty("exchange_name")
    String exchangeName;

    @JsonProperty("capital")
    BigDecimal capital;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    @JsonProperty("loss")
    BigDecimal loss;

    @JsonProperty("profit")
    BigDecimal profit;

    @JsonProperty("remaining_loss")
    BigDecimal remainingLoss;

    @JsonProperty("remaining_profit")
    BigDecimal remainingProfit;

    @JsonProperty("pending")
    BigDecimal pending;

    @JsonProperty("my_pending_share")
    BigDecimal myPendingShare;

    @JsonProperty("counterparty_pending_share")
    BigDecimal counterpartyPendingShare;

    @JsonProperty("state")
    EpisodeState state;

    @JsonProperty("active_snapshot_id")
    UUID activeSnapshotId;

    public static AccountStateResponse from(AccountState state) {
        return AccountStateResponse.builder()
            .accountId(state.getAccountId())
            .clientName(state.getClientName())
            .exchangeName(state.getExchangeName())
            .capital(state.getCapital())
            .currentBalance(state.getCurrentBalance())
            .loss(state.getLoss())
            .profit(state.getProfit())
            .remainingLoss(state.getRemainingLoss())
            .remainingProfit(state.getRemainingProfit())
            .pending(state.getPending())
            .myPendingShare(state.getMyPendingShare())
            .counterpartyPendingShare(state.getCounterpartyPendingShare())
            .state(state.getState())
            .activeSnapshotId(state.getActiveSnapshotId())
            .build();
    }
}

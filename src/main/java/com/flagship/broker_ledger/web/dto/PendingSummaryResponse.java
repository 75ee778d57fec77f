package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.pnl.PendingSummary;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class PendingSummaryResponse {

    @JsonProperty("clients_owe")
    List<Entry> clientsOwe;

    @JsonProperty("you_owe")
    List<Entry> youOwe;

    @JsonProperty("total_clients_owe")
    BigDecimal totalClientsOwe;

    @JsonProperty("total_you_owe")
    BigDecimal totalYouOwe;

    @Value
    public static class Entry {
        @JsonProperty("account_id")
        UUID accountId;

        @JsonProperty("snapshot_id")
        UUID snapshotId;

        @JsonProperty("client_name")
        String clientName;

        @JsonProperty("exchange_name")
        String exchangeName;

        @JsonProperty("remaining")
        BigDecimal remaining;

        @JsonProperty("pending")
        BigDecimal pending;

        @JsonProperty("my_share")
        BigDecimal myShare;

        @JsonProperty("counterparty_share")
        BigDecimal counterpartyShare;

        static Entry from(PendingSummary.Entry entry) {
            return new Entry(entry.getAccountId(), entry.getSnapshotId(), entry.getClientName(),
                entry.getExchangeName(), entry.getRemaining(), entry.getPending(),
                entry.getMyShare(), entry.getCounterpartyShare());
        }
    }

    public static PendingSummaryResponse from(PendingSummary summary) {
        return new PendingSummaryResponse(
            summary.getClientsOwe().stream().map(Entry::from).toList(),
            summary.getYouOwe().stream().map(Entry::from).toList(),
            summary.getTotalClientsOwe(),
            summary.getTotalYouOwe());
    }
}

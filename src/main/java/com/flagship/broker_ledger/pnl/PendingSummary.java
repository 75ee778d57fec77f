package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.account.ClientType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Open episodes across all accounts, split by who pays whom: clients that
 * owe their share of a loss, and profit shares still to be paid out.
 */
@Value
public class PendingSummary {
    List<Entry> clientsOwe;
    List<Entry> youOwe;
    BigDecimal totalClientsOwe;
    BigDecimal totalYouOwe;

    @Value
    public static class Entry {
        UUID accountId;
        UUID snapshotId;
        String clientName;
        String exchangeName;
        ClientType clientType;
        BigDecimal remaining;
        BigDecimal pending;
        BigDecimal myShare;
        BigDecimal counterpartyShare;
    }

    public static PendingSummary of(List<Entry> clientsOwe, List<Entry> youOwe) {
        return new PendingSummary(clientsOwe, youOwe, total(clientsOwe), total(youOwe));
    }

    private static BigDecimal total(List<Entry> entries) {
        return entries.stream()
            .map(Entry::getPending)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

package com.flagship.broker_ledger.ledger;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Deterministic settlement ids.
 *
 * The same request against the same episode always yields the same id, so
 * a retry finds the settlement it already wrote instead of paying twice.
 */
public final class SettlementKeys {

    private SettlementKeys() {
        // Utility class
    }

    public static UUID forPayment(UUID accountId, String direction, BalanceReference reference, UUID snapshotId,
                                  BigDecimal amount, LocalDate paymentDate, String note) {
        return nameUuid("payment",
            accountId.toString(),
            direction,
            reference.getDate().toString(),
            canonical(reference.getBalance()),
            snapshotId.toString(),
            canonical(amount),
            paymentDate.toString(),
            note != null ? note : "");
    }

    /**
     * Id of the zero-amount settlement that closes a sub-cent residual. Tied
     * to the last ledger entry, so the same residual is never closed twice.
     */
    public static UUID forResidual(UUID accountId, long lastSequenceNumber, BigDecimal capitalClosed) {
        return nameUuid("residual",
            accountId.toString(),
            Long.toString(lastSequenceNumber),
            canonical(capitalClosed));
    }

    private static String canonical(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static UUID nameUuid(String... parts) {
        return UUID.nameUUIDFromBytes(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
    }
}

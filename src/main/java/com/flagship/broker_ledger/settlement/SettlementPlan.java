package com.flagship.broker_ledger.settlement;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Validated effect of one payment on an episode. capitalClosed is the
 * unsigned magnitude; the processor applies the direction's sign.
 */
@Value
public class SettlementPlan {
    BigDecimal capitalClosed;
    BigDecimal newRemaining;
    BigDecimal pendingNew;
    boolean settled;
}

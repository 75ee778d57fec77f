package com.flagship.broker_ledger.invariant;

import com.flagship.broker_ledger.ledger.AccountLedger;
import com.flagship.broker_ledger.snapshot.EpisodeSnapshot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything the invariant checks look at, read inside the account lock.
 * expectedCapital is optional; without it the capital prediction is not
 * checked.
 */
@Value
@Builder
public class InvariantContext {
    AccountLedger ledger;
    @Singular
    List<EpisodeSnapshot> activeSnapshots;
    BigDecimal currentBalance;
    BigDecimal expectedCapital;
}

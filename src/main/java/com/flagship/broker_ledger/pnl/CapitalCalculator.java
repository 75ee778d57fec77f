package com.flagship.broker_ledger.pnl;

import com.flagship.broker_ledger.ledger.AccountLedger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * CAPITAL = sum(FUNDING) - sum(capital_closed).
 *
 * Always derived from the ledger. The cached column on the account is only
 * a copy of this value.
 */
@Component
public class CapitalCalculator {

    public BigDecimal capital(AccountLedger ledger) {
        return ledger.totalFunding().subtract(ledger.totalCapitalClosed());
    }
}

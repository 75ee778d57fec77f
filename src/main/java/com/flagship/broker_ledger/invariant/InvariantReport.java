package com.flagship.broker_ledger.invariant;

import lombok.Value;

import java.util.List;

@Value
public class InvariantReport {
    List<String> violations;

    public boolean isHolding() {
        return violations.isEmpty();
    }
}

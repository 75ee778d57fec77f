package com.flagship.broker_ledger.invariant;

import java.util.List;
import java.util.UUID;

/**
 * Thrown inside a mutation when the ledger no longer adds up. Rolls the
 * whole unit back; the state is never patched up instead.
 */
public class InvariantViolationException extends RuntimeException {

    private final UUID accountId;
    private final List<String> violations;

    public InvariantViolationException(UUID accountId, List<String> violations) {
        super("Invariant violated for account " + accountId + ": " + String.join("; ", violations));
        this.accountId = accountId;
        this.violations = List.copyOf(violations);
    }

    public UUID getAccountId() {
        return accountId;
    }

    public List<String> getViolations() {
        return violations;
    }
}

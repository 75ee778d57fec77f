package com.flagship.broker_ledger.settlement;

import com.flagship.broker_ledger.invariant.InvariantViolationException;
import com.flagship.broker_ledger.observability.CorrelationContext;
import com.flagship.broker_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Entry point for settlement payments.
 *
 * Not transactional itself: {@link SettlementProcessor} owns the
 * transaction, so by the time an exception reaches this class the unit has
 * already been rolled back. Every outcome, including failures, comes back
 * as a {@link SettlementResult}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final SettlementProcessor processor;
    private final LedgerMetrics ledgerMetrics;

    /**
     * A client pays (part of) its share of the open loss.
     */
    public SettlementResult settle(UUID accountId, BigDecimal amount, LocalDate paymentDate, String note) {
        return execute(SettlementCommand.lossPayment(accountId, amount, paymentDate, note));
    }

    /**
     * (Part of) the shares of the open profit is paid out. Books the profit
     * into capital, so capital_closed is negative.
     */
    public SettlementResult withdrawProfit(UUID accountId, BigDecimal amount, LocalDate paymentDate, String note) {
        return execute(SettlementCommand.profitPayout(accountId, amount, paymentDate, note));
    }

    private SettlementResult execute(SettlementCommand command) {
        long startTime = System.currentTimeMillis();
        String direction = command.getDirection().name();

        try (MDC.MDCCloseable ignored = CorrelationContext.forAccount(command.getAccountId())) {
            log.info("Settlement requested: direction={}, amount={}, date={}",
                direction, command.getAmount(), command.getPaymentDate());

            SettlementResult result = run(command);
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordSettlement(direction, outcomeTag(result));
            ledgerMetrics.recordSettlementLatency(direction, duration);
            return result;
        } finally {
            CorrelationContext.clearSettlementId();
        }
    }

    private SettlementResult run(SettlementCommand command) {
        try {
            return processor.process(command);
        } catch (InvariantViolationException e) {
            ledgerMetrics.incrementInvariantViolations();
            log.error("Settlement rolled back, invariant violated: accountId={}, direction={}, amount={}, "
                    + "date={}, note={}, violations={}",
                command.getAccountId(), command.getDirection(), command.getAmount(),
                command.getPaymentDate(), command.getNote(), e.getViolations(), e);
            return SettlementResult.failure(SettlementError.Code.INVARIANT_VIOLATION, e.getMessage());
        } catch (PessimisticLockingFailureException | DuplicateKeyException e) {
            ledgerMetrics.incrementConcurrencyConflicts();
            log.warn("Settlement hit a concurrent writer, safe to retry: {}", e.getMessage());
            return SettlementResult.failure(SettlementError.Code.CONCURRENCY_CONFLICT,
                "Account is busy, retry the request");
        }
    }

    private static String outcomeTag(SettlementResult result) {
        if (!result.isSuccess()) {
            return result.getError().getCode().name();
        }
        return result.getOutcome().isDuplicate() ? "duplicate" : "success";
    }
}

package com.flagship.broker_ledger.web;

import com.flagship.broker_ledger.pnl.AccountStateService;
import com.flagship.broker_ledger.settlement.SettlementError;
import com.flagship.broker_ledger.settlement.SettlementResult;
import com.flagship.broker_ledger.settlement.SettlementService;
import com.flagship.broker_ledger.web.dto.PendingSummaryResponse;
import com.flagship.broker_ledger.web.dto.SettlementRequest;
import com.flagship.broker_ledger.web.dto.SettlementResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

/**
 * Loss payments, profit payouts and the pending overview.
 *
 * A new settlement answers 201, a replayed one 200 with duplicate = true.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SettlementController {

    private final SettlementService settlementService;
    private final AccountStateService accountStateService;

    @PostMapping("/accounts/{id}/settlements")
    public ResponseEntity<?> settle(@PathVariable("id") UUID id, @Valid @RequestBody SettlementRequest request) {
        return toResponse(settlementService.settle(id, request.getAmount(), request.getDate(), request.getNote()));
    }

    @PostMapping("/accounts/{id}/withdrawals")
    public ResponseEntity<?> withdrawProfit(@PathVariable("id") UUID id,
                                            @Valid @RequestBody SettlementRequest request) {
        return toResponse(settlementService.withdrawProfit(id, request.getAmount(), request.getDate(),
            request.getNote()));
    }

    @GetMapping("/pending")
    public PendingSummaryResponse pending() {
        return PendingSummaryResponse.from(accountStateService.pendingSummary());
    }

    private static ResponseEntity<?> toResponse(SettlementResult result) {
        if (result.isSuccess()) {
            HttpStatus status = result.getOutcome().isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
            return ResponseEntity.status(status).body(SettlementResponse.from(result.getOutcome()));
        }

        SettlementError error = result.getError();
        GlobalExceptionHandler.ErrorResponse body = GlobalExceptionHandler.ErrorResponse.builder()
            .error(error.getCode().name())
            .message(error.getMessage())
            .retryable(error.isRetryable())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(statusFor(error.getCode())).body(body);
    }

    private static HttpStatus statusFor(SettlementError.Code code) {
        return switch (code) {
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NO_ACTIVE_LOSS, NO_ACTIVE_PROFIT, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_PAYMENT, CAPITAL_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVARIANT_VIOLATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}

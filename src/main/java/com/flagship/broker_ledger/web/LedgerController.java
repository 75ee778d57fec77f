package com.flagship.broker_ledger.web;

import com.flagship.broker_ledger.ledger.LedgerService;
import com.flagship.broker_ledger.ledger.Transaction;
import com.flagship.broker_ledger.web.dto.BalanceRecordRequest;
import com.flagship.broker_ledger.web.dto.FundingRequest;
import com.flagship.broker_ledger.web.dto.SnapshotResponse;
import com.flagship.broker_ledger.web.dto.TransactionResponse;
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

import java.util.List;
import java.util.UUID;

/**
 * Funding, balance records and the read-only history of an account.
 */
@RestController
@RequestMapping("/api/accounts/{id}")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/fundings")
    public ResponseEntity<TransactionResponse> createFunding(@PathVariable("id") UUID id,
                                                             @Valid @RequestBody FundingRequest request) {
        Transaction funding = ledgerService.createFunding(id, request.getAmount(), request.getDate(),
            request.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(funding));
    }

    @PostMapping("/balance-records")
    public ResponseEntity<TransactionResponse> createBalanceRecord(@PathVariable("id") UUID id,
                                                                   @Valid @RequestBody BalanceRecordRequest request) {
        Transaction record = ledgerService.createBalanceRecord(id, request.getDate(), request.getBalance(),
            request.getAdjustment(), request.getNote());
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(record));
    }

    @GetMapping("/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("id") UUID id) {
        return ledgerService.getTransactions(id).stream()
            .map(TransactionResponse::from)
            .toList();
    }

    @GetMapping("/snapshots")
    public List<SnapshotResponse> getSnapshots(@PathVariable("id") UUID id) {
        return ledgerService.getSnapshots(id).stream()
            .map(SnapshotResponse::from)
            .toList();
    }
}

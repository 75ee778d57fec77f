package com.flagship.broker_ledger.web;

import com.flagship.broker_ledger.account.AccountService;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.pnl.AccountStateService;
import com.flagship.broker_ledger.web.dto.AccountResponse;
import com.flagship.broker_ledger.web.dto.AccountStateResponse;
import com.flagship.broker_ledger.web.dto.CreateAccountRequest;
import com.flagship.broker_ledger.web.dto.UpdateSharesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final AccountStateService accountStateService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        ClientExchangeAccount account = accountService.createAccount(
            request.getClientName(),
            request.getExchangeName(),
            request.getClientType(),
            request.getMySharePct(),
            request.getCompanySharePct());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts() {
        return accountService.listAccounts().stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    /**
     * New defaults apply to the next episode only.
     */
    @PutMapping("/{id}/shares")
    public AccountResponse updateShares(@PathVariable("id") UUID id,
                                        @Valid @RequestBody UpdateSharesRequest request) {
        return AccountResponse.from(
            accountService.updateDefaultShares(id, request.getMySharePct(), request.getCompanySharePct()));
    }

    @GetMapping("/{id}/state")
    public AccountStateResponse getState(@PathVariable("id") UUID id) {
        return AccountStateResponse.from(accountStateService.getState(id));
    }
}

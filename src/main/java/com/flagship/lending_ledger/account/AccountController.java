package com.flagship.lending_ledger.account;

import com.flagship.lending_ledger.account.dto.AccountBalancesResponse;
import com.flagship.lending_ledger.account.dto.FundAccountRequest;
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

import java.util.UUID;

/**
 * Account balance endpoints. Balances are owned by the wider platform; these exist so
 * accounts can be opened and funded in front of the lending operations.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountLedgerService accountLedgerService;

    @PostMapping
    public ResponseEntity<AccountBalancesResponse> createAccount() {
        UUID accountId = accountLedgerService.createAccount();
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AccountBalancesResponse.from(accountLedgerService.getBalances(accountId)));
    }

    @PostMapping("/{accountId}/deposits")
    public ResponseEntity<AccountBalancesResponse> deposit(@PathVariable("accountId") UUID accountId,
                                                           @Valid @RequestBody FundAccountRequest request) {
        AccountBalances balances = accountLedgerService.deposit(accountId, request.getAsset(), request.getAmount());
        return ResponseEntity.ok(AccountBalancesResponse.from(balances));
    }

    @GetMapping("/{accountId}/balances")
    public ResponseEntity<AccountBalancesResponse> getBalances(@PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(AccountBalancesResponse.from(accountLedgerService.getBalances(accountId)));
    }
}

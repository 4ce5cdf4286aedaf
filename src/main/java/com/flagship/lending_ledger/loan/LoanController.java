package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.liquidation.LiquidationResult;
import com.flagship.lending_ledger.liquidation.LiquidationService;
import com.flagship.lending_ledger.loan.dto.AddCollateralRequest;
import com.flagship.lending_ledger.loan.dto.AddCollateralResponse;
import com.flagship.lending_ledger.loan.dto.BorrowRequest;
import com.flagship.lending_ledger.loan.dto.BorrowResponse;
import com.flagship.lending_ledger.loan.dto.DepositCollateralRequest;
import com.flagship.lending_ledger.loan.dto.DepositCollateralResponse;
import com.flagship.lending_ledger.loan.dto.LoanOperationResponse;
import com.flagship.lending_ledger.loan.dto.LoanStatusResponse;
import com.flagship.lending_ledger.loan.dto.RepayRequest;
import com.flagship.lending_ledger.loan.dto.RepayResponse;
import com.flagship.lending_ledger.loan.dto.SellCollateralRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Loan operations for the owner of an account.
 *
 * The account ID comes from the path; authenticating the caller as its owner happens
 * in front of this service.
 */
@RestController
@RequestMapping("/api/accounts/{accountId}/loan")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    private final LendingEngine lendingEngine;
    private final LiquidationService liquidationService;

    @PostMapping("/collateral")
    public ResponseEntity<DepositCollateralResponse> depositCollateral(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody DepositCollateralRequest request) {
        log.info("Received collateral deposit: accountId={}, cryptoAmount={}, ltvRatio={}",
            accountId, request.getCryptoAmount(), request.getLtvRatio());
        DepositCollateralResponse response =
            lendingEngine.depositCollateral(accountId, request.getCryptoAmount(), request.getLtvRatio());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/borrow")
    public ResponseEntity<BorrowResponse> borrow(@PathVariable("accountId") UUID accountId,
                                                 @Valid @RequestBody BorrowRequest request) {
        log.info("Received borrow request: accountId={}, baseAmount={}", accountId, request.getBaseAmount());
        return ResponseEntity.ok(lendingEngine.borrow(accountId, request.getBaseAmount()));
    }

    @PostMapping("/repay")
    public ResponseEntity<RepayResponse> repay(@PathVariable("accountId") UUID accountId,
                                               @Valid @RequestBody RepayRequest request) {
        log.info("Received repayment: accountId={}, baseAmount={}", accountId, request.getBaseAmount());
        return ResponseEntity.ok(lendingEngine.repay(accountId, request.getBaseAmount()));
    }

    @PostMapping("/add-collateral")
    public ResponseEntity<AddCollateralResponse> addCollateral(@PathVariable("accountId") UUID accountId,
                                                               @Valid @RequestBody AddCollateralRequest request) {
        log.info("Received collateral top-up: accountId={}, cryptoAmount={}", accountId, request.getCryptoAmount());
        return ResponseEntity.ok(lendingEngine.addCollateral(accountId, request.getCryptoAmount()));
    }

    @PostMapping("/sell-collateral")
    public ResponseEntity<LiquidationResult> sellCollateral(@PathVariable("accountId") UUID accountId,
                                                            @Valid @RequestBody SellCollateralRequest request) {
        log.info("Received collateral sale: accountId={}, cryptoAmount={}", accountId, request.getCryptoAmount());
        return ResponseEntity.ok(liquidationService.sellCollateral(accountId, request.getCryptoAmount()));
    }

    @PostMapping("/liquidate")
    public ResponseEntity<LiquidationResult> liquidate(@PathVariable("accountId") UUID accountId) {
        log.info("Received full liquidation request: accountId={}", accountId);
        return ResponseEntity.ok(liquidationService.liquidate(accountId));
    }

    @GetMapping
    public ResponseEntity<LoanStatusResponse> getStatus(@PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(lendingEngine.getStatus(accountId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<LoanOperationResponse>> getHistory(
            @PathVariable("accountId") UUID accountId,
            @RequestParam(name = "loan_id", required = false) UUID loanId) {
        return ResponseEntity.ok(lendingEngine.getHistory(accountId, loanId));
    }
}

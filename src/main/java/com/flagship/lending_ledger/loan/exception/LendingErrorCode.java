package com.flagship.lending_ledger.loan.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Business rule violations raised by lending operations, with the HTTP status the API maps them to.
 */
@Getter
@RequiredArgsConstructor
public enum LendingErrorCode {

    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient available balance"),
    INSUFFICIENT_CAPACITY(HttpStatus.UNPROCESSABLE_ENTITY, "Amount exceeds available borrowing capacity"),
    LOAN_ALREADY_ACTIVE(HttpStatus.CONFLICT, "Account already has an active loan"),
    NO_ACTIVE_LOAN(HttpStatus.NOT_FOUND, "Account has no active loan"),
    LOAN_NOT_FOUND(HttpStatus.NOT_FOUND, "Loan not found"),
    EXCEEDS_OUTSTANDING_DEBT(HttpStatus.UNPROCESSABLE_ENTITY, "Repayment exceeds total amount due"),
    MINIMUM_INTEREST_NOT_MET(HttpStatus.UNPROCESSABLE_ENTITY, "Closing repayment must include the minimum interest"),
    INSUFFICIENT_COLLATERAL(HttpStatus.UNPROCESSABLE_ENTITY, "Amount exceeds collateral held"),
    INSUFFICIENT_COLLATERAL_FOR_LIQUIDATION(HttpStatus.UNPROCESSABLE_ENTITY, "Collateral cannot cover the outstanding debt"),
    NO_OUTSTANDING_DEBT(HttpStatus.UNPROCESSABLE_ENTITY, "Loan has no outstanding debt"),
    RATE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "No fresh market rate available"),
    ACCOUNT_NOT_FOUND(HttpStatus.NOT_FOUND, "Account not found"),
    INVALID_SETTING(HttpStatus.BAD_REQUEST, "Invalid lending setting");

    private final HttpStatus httpStatus;
    private final String defaultMessage;
}

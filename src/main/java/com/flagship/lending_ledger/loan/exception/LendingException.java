package com.flagship.lending_ledger.loan.exception;

import lombok.Getter;

/**
 * A lending operation violated a business rule. Thrown before any state is changed,
 * or inside the transaction so that everything rolls back.
 */
@Getter
public class LendingException extends RuntimeException {

    private final LendingErrorCode errorCode;

    public LendingException(LendingErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public LendingException(LendingErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LendingException(LendingErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static LendingException of(LendingErrorCode errorCode, String format, Object... args) {
        return new LendingException(errorCode, String.format(format, args));
    }
}

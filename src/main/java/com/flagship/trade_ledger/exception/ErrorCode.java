package com.flagship.trade_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Error categories surfaced by ledger operations.
 * Each category maps to one HTTP status at the REST boundary.
 */
public enum ErrorCode {
    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_EXISTS(HttpStatus.CONFLICT),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_STATE(HttpStatus.CONFLICT),
    CORRUPT_RECORD(HttpStatus.INTERNAL_SERVER_ERROR),
    STORE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

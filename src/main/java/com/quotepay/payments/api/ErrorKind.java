package com.quotepay.payments.api;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned in the {@code error} field of API error bodies.
 */
public enum ErrorKind {

    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    INVALID_CURRENCY(HttpStatus.BAD_REQUEST),
    UNSUPPORTED_GATEWAY(HttpStatus.BAD_REQUEST),
    AMOUNT_TOO_SMALL(HttpStatus.BAD_REQUEST),
    QUOTE_NOT_PAYABLE(HttpStatus.CONFLICT),
    QUOTE_NOT_FOUND(HttpStatus.NOT_FOUND),
    TRANSACTION_NOT_FOUND(HttpStatus.NOT_FOUND),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    CONFIGURATION_MISSING(HttpStatus.INTERNAL_SERVER_ERROR),
    GATEWAY_ERROR(HttpStatus.BAD_GATEWAY),
    PERSISTENCE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    VERIFICATION_FAILED(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}

package com.quotepay.payments.api;

/**
 * Malformed or unacceptable input. Raised before any ledger row exists.
 */
public class PaymentValidationException extends PaymentException {

    public PaymentValidationException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public PaymentValidationException(String message) {
        super(ErrorKind.VALIDATION_FAILED, message);
    }
}

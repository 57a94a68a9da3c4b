package com.quotepay.payments.api;

/**
 * Caller is unauthenticated ({@link ErrorKind#UNAUTHORIZED}) or may not pay
 * for the requested quotes ({@link ErrorKind#FORBIDDEN}).
 */
public class PaymentAuthorizationException extends PaymentException {

    public PaymentAuthorizationException(ErrorKind kind, String message) {
        super(kind, message, kind == ErrorKind.FORBIDDEN
                ? "You are not allowed to pay for these quotes"
                : "Authentication required", null);
    }
}

package com.quotepay.payments.api;

/**
 * Base of all payment errors. {@link #getMessage()} is for logs;
 * {@link #getPublicMessage()} is what an API caller may see.
 */
public class PaymentException extends RuntimeException {

    private final ErrorKind kind;
    private final String publicMessage;

    public PaymentException(ErrorKind kind, String message) {
        this(kind, message, message, null);
    }

    protected PaymentException(ErrorKind kind, String message, String publicMessage, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.publicMessage = publicMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getPublicMessage() {
        return publicMessage;
    }
}

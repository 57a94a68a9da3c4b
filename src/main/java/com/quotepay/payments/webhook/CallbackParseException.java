package com.quotepay.payments.webhook;

/**
 * Callback payload is not something the gateway handler can read.
 */
public class CallbackParseException extends RuntimeException {

    public CallbackParseException(String message) {
        super(message);
    }

    public CallbackParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.quotepay.payments.api;

/**
 * Callback signature or hash did not verify. The callback is still recorded,
 * with {@code verified=false}.
 */
public class SignatureVerificationException extends PaymentException {

    public SignatureVerificationException(String message) {
        super(ErrorKind.VERIFICATION_FAILED, message, "Callback could not be verified", null);
    }
}

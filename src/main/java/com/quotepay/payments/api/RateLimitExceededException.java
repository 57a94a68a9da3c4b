package com.quotepay.payments.api;

public class RateLimitExceededException extends PaymentException {

    public RateLimitExceededException(String message) {
        super(ErrorKind.RATE_LIMITED, message, "Too many payment attempts. Please wait a minute and try again.", null);
    }
}

package com.quotepay.payments.adapters;

/**
 * The hosted wallet login endpoint did not hand out a usable access token.
 * Callers fall back to API-key headers.
 */
public class WalletAuthenticationException extends RuntimeException {

    public WalletAuthenticationException(String message) {
        super(message);
    }

    public WalletAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}

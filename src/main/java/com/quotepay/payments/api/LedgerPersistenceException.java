package com.quotepay.payments.api;

/**
 * A ledger write failed. Whether this leaves the attempt failed or orphaned
 * depends on whether the external call had already succeeded.
 */
public class LedgerPersistenceException extends PaymentException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_ERROR, message,
                "Payment could not be recorded. Please contact support if you were charged.", cause);
    }
}

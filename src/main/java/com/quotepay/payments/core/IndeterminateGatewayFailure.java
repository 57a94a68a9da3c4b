package com.quotepay.payments.core;

import com.quotepay.payments.api.GatewayException;

import java.util.function.Predicate;

/**
 * Failure predicate for gateway circuit breakers. A definitive rejection
 * (decline, validation error, any 4xx) says nothing about gateway health and
 * is not recorded; timeouts, I/O errors, 5xx and unexpected exceptions are.
 */
public class IndeterminateGatewayFailure implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        if (throwable instanceof GatewayException) {
            return ((GatewayException) throwable).isExternalEffectPossible();
        }
        return true;
    }
}

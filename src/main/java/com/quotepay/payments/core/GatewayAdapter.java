package com.quotepay.payments.core;

import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentCreationResult;
import com.quotepay.payments.domain.gateway.GatewayRequest;

/**
 * What every gateway adapter implements. Creation runs in two steps so the
 * orchestrator can write the ledger row in between: {@link #prepare} has no
 * side effects, {@link #submit} performs the external call.
 */
public interface GatewayAdapter {

    GatewayCode getGatewayCode();

    /**
     * Name used for this adapter's circuit breaker.
     */
    default String getAdapterName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Resolves credentials, validates currency and minimum amount, converts
     * and signs. Must not contact the gateway.
     *
     * @throws com.quotepay.payments.api.PaymentValidationException for unsupported currency or too small amount
     * @throws com.quotepay.payments.api.GatewayConfigurationException when credentials are missing
     */
    GatewayRequest prepare(NormalizedPaymentRequest request);

    /**
     * Performs the external call, if any.
     *
     * @throws com.quotepay.payments.api.GatewayException when the gateway rejects or cannot be reached
     */
    PaymentCreationResult submit(GatewayRequest request);

    default PaymentCreationResult createPayment(NormalizedPaymentRequest request) {
        return submit(prepare(request));
    }

    /**
     * False for methods settled outside any gateway (bank transfer, cash on
     * delivery); those attempts never get a gateway reference.
     */
    default boolean hasGatewayLeg() {
        return true;
    }
}

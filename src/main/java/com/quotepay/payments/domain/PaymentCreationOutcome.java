package com.quotepay.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * What the orchestrator hands back to checkout for one payment attempt.
 */
@Value
@Builder
public class PaymentCreationOutcome {

    boolean success;
    String transactionId;
    GatewayCode gatewayCode;
    PaymentState paymentState;

    String redirectUrl;
    String formMethod;
    Map<String, String> formData;
    String clientSecret;

    BigDecimal chargedAmount;
    String chargedCurrency;

    /** False for manual methods: there is nothing for the client to track. */
    boolean trackable;

    /** Safe, generic message on failure. */
    String error;
}

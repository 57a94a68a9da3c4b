package com.quotepay.payments.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.PaymentCreationOutcome;
import com.quotepay.payments.domain.PaymentState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * What checkout needs to continue: a form to auto-submit, a client secret
 * for the card element, or a URL to redirect to.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentCreationResponseDto {

    boolean success;
    String transactionId;
    GatewayCode gateway;
    PaymentState paymentState;
    String redirectUrl;
    String method;
    Map<String, String> formData;
    String clientSecret;
    BigDecimal amount;
    String currency;
    boolean trackable;
    String error;

    public static PaymentCreationResponseDto from(PaymentCreationOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("PaymentCreationOutcome cannot be null");
        }
        return PaymentCreationResponseDto.builder()
                .success(outcome.isSuccess())
                .transactionId(outcome.getTransactionId())
                .gateway(outcome.getGatewayCode())
                .paymentState(outcome.getPaymentState())
                .redirectUrl(outcome.getRedirectUrl())
                .method(outcome.getFormMethod())
                .formData(outcome.getFormData())
                .clientSecret(outcome.getClientSecret())
                .amount(outcome.getChargedAmount())
                .currency(outcome.getChargedCurrency())
                .trackable(outcome.isTrackable())
                .error(outcome.getError())
                .build();
    }
}

package com.quotepay.payments.api;

public class GatewayConfigurationException extends PaymentException {

    public GatewayConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION_MISSING, message,
                "This payment method is temporarily unavailable", null);
    }
}

package com.quotepay.payments.api;

import com.quotepay.payments.domain.GatewayCode;

/**
 * The external gateway call did not succeed. {@link #isExternalEffectPossible()}
 * is false for definitive rejections and true when we cannot tell whether
 * the gateway created anything (timeouts, I/O errors, 5xx).
 */
public class GatewayException extends PaymentException {

    private static final String PUBLIC_MESSAGE =
            "Payment could not be created. Please try again or choose another payment method.";

    private final GatewayCode gatewayCode;
    private final boolean externalEffectPossible;

    private GatewayException(GatewayCode gatewayCode, String message, boolean externalEffectPossible, Throwable cause) {
        super(ErrorKind.GATEWAY_ERROR, message, PUBLIC_MESSAGE, cause);
        this.gatewayCode = gatewayCode;
        this.externalEffectPossible = externalEffectPossible;
    }

    public static GatewayException rejected(GatewayCode gatewayCode, String message, Throwable cause) {
        return new GatewayException(gatewayCode, message, false, cause);
    }

    public static GatewayException indeterminate(GatewayCode gatewayCode, String message, Throwable cause) {
        return new GatewayException(gatewayCode, message, true, cause);
    }

    public GatewayCode getGatewayCode() {
        return gatewayCode;
    }

    public boolean isExternalEffectPossible() {
        return externalEffectPossible;
    }
}

package com.quotepay.payments.domain.gateway;

import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.domain.GatewayCode;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class WalletIntentRequest implements GatewayRequest {

    String transactionId;
    BigDecimal chargedAmount;
    String chargedCurrency;
    long chargedAmountMinor;
    String merchantOrderId;
    String descriptor;
    String returnUrl;
    Map<String, String> metadata;

    @ToString.Exclude
    GatewaySettings settings;

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.HOSTED_WALLET;
    }
}

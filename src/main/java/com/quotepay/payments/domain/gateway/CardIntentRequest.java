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
public class CardIntentRequest implements GatewayRequest {

    String transactionId;
    BigDecimal chargedAmount;
    String chargedCurrency;
    long chargedAmountMinor;
    String description;
    String receiptEmail;
    Map<String, String> metadata;

    @ToString.Exclude
    GatewaySettings settings;

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.CARD;
    }
}

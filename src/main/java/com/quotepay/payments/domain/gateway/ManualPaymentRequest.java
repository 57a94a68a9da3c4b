package com.quotepay.payments.domain.gateway;

import com.quotepay.payments.domain.GatewayCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ManualPaymentRequest implements GatewayRequest {

    GatewayCode gatewayCode;
    String transactionId;
    BigDecimal chargedAmount;
    String chargedCurrency;
    long chargedAmountMinor;
}

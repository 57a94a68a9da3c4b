package com.quotepay.payments.domain.gateway;

import com.quotepay.payments.domain.GatewayCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signed form for hash-based gateways; the browser posts it to
 * {@link #actionUrl} itself.
 */
@Value
@Builder
public class HashFormRequest implements GatewayRequest {

    GatewayCode gatewayCode;
    String transactionId;
    String actionUrl;
    LinkedHashMap<String, String> formFields;

    BigDecimal chargedAmount;
    String chargedCurrency;
    long chargedAmountMinor;

    BigDecimal requestedAmount;
    String requestedCurrency;
    BigDecimal exchangeRate;

    @Override
    public Map<String, Object> getAuditDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requested_amount", requestedAmount.toPlainString());
        details.put("requested_currency", requestedCurrency);
        details.put("exchange_rate", exchangeRate.toPlainString());
        details.put("settlement_currency", chargedCurrency);
        return details;
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Regional hash gateway A. Settles in INR.
 */
@Component
public class RegionalHashGatewayAAdapter extends HashFormGatewayAdapter {

    public RegionalHashGatewayAAdapter(GatewayConfigurationStore configurationStore,
                                       CurrencyNormalizer currencyNormalizer,
                                       @Value("${payment.callback.base-url:http://localhost:8080}") String callbackBaseUrl) {
        super(configurationStore, currencyNormalizer, callbackBaseUrl);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.REGIONAL_HASH_A;
    }

    @Override
    protected String defaultSettlementCurrency() {
        return "INR";
    }

    @Override
    protected String defaultExchangeRateCountry() {
        return "IN";
    }
}

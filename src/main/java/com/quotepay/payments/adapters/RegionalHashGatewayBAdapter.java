package com.quotepay.payments.adapters;

import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Regional hash gateway B. Same form and hash layout as A, settles in NPR.
 */
@Component
public class RegionalHashGatewayBAdapter extends HashFormGatewayAdapter {

    public RegionalHashGatewayBAdapter(GatewayConfigurationStore configurationStore,
                                       CurrencyNormalizer currencyNormalizer,
                                       @Value("${payment.callback.base-url:http://localhost:8080}") String callbackBaseUrl) {
        super(configurationStore, currencyNormalizer, callbackBaseUrl);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.REGIONAL_HASH_B;
    }

    @Override
    protected String defaultSettlementCurrency() {
        return "NPR";
    }

    @Override
    protected String defaultExchangeRateCountry() {
        return "NP";
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import org.springframework.stereotype.Component;

@Component
public class CashOnDeliveryAdapter extends ManualPaymentAdapter {

    public CashOnDeliveryAdapter(GatewayConfigurationStore configurationStore, CurrencyNormalizer currencyNormalizer) {
        super(configurationStore, currencyNormalizer);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.CASH_ON_DELIVERY;
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import org.springframework.stereotype.Component;

@Component
public class BankTransferAdapter extends ManualPaymentAdapter {

    public BankTransferAdapter(GatewayConfigurationStore configurationStore, CurrencyNormalizer currencyNormalizer) {
        super(configurationStore, currencyNormalizer);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.BANK_TRANSFER;
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.api.GatewayConfigurationException;
import com.quotepay.payments.core.GatewayAdapter;
import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.PaymentCreationResult;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.domain.gateway.ManualPaymentRequest;
import com.quotepay.payments.integration.GatewayConfigurationStore;

import java.math.BigDecimal;

/**
 * Offline methods settled outside any gateway. There is no external call,
 * so the ledger records the payment directly and staff confirm receipt.
 * Enabled unless configured with {@code enabled: false}.
 */
public abstract class ManualPaymentAdapter implements GatewayAdapter {

    private final GatewayConfigurationStore configurationStore;
    private final CurrencyNormalizer currencyNormalizer;

    protected ManualPaymentAdapter(GatewayConfigurationStore configurationStore, CurrencyNormalizer currencyNormalizer) {
        this.configurationStore = configurationStore;
        this.currencyNormalizer = currencyNormalizer;
    }

    @Override
    public boolean hasGatewayLeg() {
        return false;
    }

    @Override
    public GatewayRequest prepare(NormalizedPaymentRequest request) {
        configurationStore.findSettings(getGatewayCode()).ifPresent(settings -> {
            if (!settings.isEnabled()) {
                throw new GatewayConfigurationException("Gateway disabled: " + getGatewayCode().getCode());
            }
        });
        String currency = currencyNormalizer.normalizeCode(request.getCurrency());
        long amountMinor = currencyNormalizer.toMinorUnits(request.getAmount(), currency);
        BigDecimal charged = currencyNormalizer.fromMinorUnits(amountMinor, currency);
        return ManualPaymentRequest.builder()
                .gatewayCode(getGatewayCode())
                .transactionId(request.getTransactionId())
                .chargedAmount(charged)
                .chargedCurrency(currency)
                .chargedAmountMinor(amountMinor)
                .build();
    }

    @Override
    public PaymentCreationResult submit(GatewayRequest gatewayRequest) {
        GatewayRequest.narrow(gatewayRequest, ManualPaymentRequest.class);
        return PaymentCreationResult.builder().success(true).build();
    }
}

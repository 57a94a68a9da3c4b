package com.quotepay.payments.integration;

import com.quotepay.payments.api.GatewayConfigurationException;
import com.quotepay.payments.config.PaymentGatewayProperties;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.domain.GatewayCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class PropertiesGatewayConfigurationStore implements GatewayConfigurationStore {

    private final PaymentGatewayProperties properties;

    @Override
    public Optional<GatewaySettings> findSettings(GatewayCode gatewayCode) {
        return Optional.ofNullable(properties.getGateways().get(gatewayCode.getCode()));
    }

    @Override
    public GatewaySettings requireSettings(GatewayCode gatewayCode) {
        GatewaySettings settings = findSettings(gatewayCode)
                .orElseThrow(() -> new GatewayConfigurationException("No configuration for gateway " + gatewayCode.getCode()));
        if (!settings.isEnabled()) {
            throw new GatewayConfigurationException("Gateway disabled: " + gatewayCode.getCode());
        }
        return settings;
    }

    @Override
    public Optional<BigDecimal> exchangeRateFromUsd(String countryCode) {
        if (countryCode == null) {
            return Optional.empty();
        }
        return properties.getExchangeRates().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(countryCode))
                .map(Map.Entry::getValue)
                .filter(rate -> rate != null && rate.signum() > 0)
                .findFirst();
    }
}

package com.quotepay.payments.integration;

import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.domain.GatewayCode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only source of gateway credentials and exchange rates, consulted at
 * request time.
 */
public interface GatewayConfigurationStore {

    Optional<GatewaySettings> findSettings(GatewayCode gatewayCode);

    /**
     * @throws com.quotepay.payments.api.GatewayConfigurationException when the
     *         gateway has no settings or is disabled
     */
    GatewaySettings requireSettings(GatewayCode gatewayCode);

    /** Units of the country's currency per 1 USD. */
    Optional<BigDecimal> exchangeRateFromUsd(String countryCode);
}

package com.quotepay.payments.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-gateway credentials and settings, bound from {@code payment.gateways.*},
 * plus the USD exchange rate per country code. Read-only at runtime.
 */
@Data
@ConfigurationProperties(prefix = "payment")
public class PaymentGatewayProperties {

    /** Keyed by gateway code, e.g. {@code card}, {@code regional-hash-a}. */
    private Map<String, GatewaySettings> gateways = new HashMap<>();

    /** Units of local currency per 1 USD, keyed by ISO country code. */
    private Map<String, BigDecimal> exchangeRates = new HashMap<>();

    @Data
    public static class GatewaySettings {

        private boolean enabled = true;
        private boolean testMode = true;

        /** Merchant key (hash gateways). */
        private String merchantKey;

        /** OAuth client id (hosted wallet). */
        private String clientId;

        /** Secret key, hash salt or API key depending on the gateway. */
        private String secretKey;

        private String webhookSecret;
        private String signatureHeader;
        private long signatureToleranceSeconds = 300;

        private String apiBaseUrl;
        private String testApiBaseUrl;

        /** Currency the gateway settles in (hash gateways). */
        private String settlementCurrency;

        /** Country whose USD rate converts into the settlement currency. */
        private String exchangeRateCountry;

        /** Smallest chargeable amount in major units of the charged currency. */
        private BigDecimal minimumAmount;

        /** Allow-list of ISO codes; empty means any. */
        private List<String> supportedCurrencies = new ArrayList<>();

        public String resolveBaseUrl() {
            if (testMode && testApiBaseUrl != null && !testApiBaseUrl.isBlank()) {
                return testApiBaseUrl;
            }
            return apiBaseUrl;
        }
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.GatewayConfigurationException;
import com.quotepay.payments.api.PaymentValidationException;
import com.quotepay.payments.compliance.PiiMasker;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.GatewayAdapter;
import com.quotepay.payments.core.crypto.HashFields;
import com.quotepay.payments.core.crypto.RegionalHashScheme;
import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.CustomerInfo;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.OrderReference;
import com.quotepay.payments.domain.PaymentCreationResult;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.domain.gateway.HashFormRequest;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for gateways that take a SHA-512 signed HTML form posted by the
 * browser. Nothing is sent server-side: {@link #submit} only returns the form,
 * so the transaction id doubles as the gateway reference.
 * <p>
 * Amounts are charged in the gateway's settlement currency. USD requests
 * are converted with the configured rate for the settlement country.
 */
@Slf4j
public abstract class HashFormGatewayAdapter implements GatewayAdapter {

    static final String PAYMENT_PATH = "/_payment";
    static final String RETURN_PATH = "/api/v1/payments/return/";
    static final String SOURCE_CURRENCY = "USD";
    static final BigDecimal DEFAULT_MINIMUM = new BigDecimal("1.00");
    static final int PRODUCT_INFO_MAX = 100;
    static final String DEFAULT_PRODUCT_INFO = "Quote payment";

    private final GatewayConfigurationStore configurationStore;
    private final CurrencyNormalizer currencyNormalizer;
    private final String callbackBaseUrl;

    protected HashFormGatewayAdapter(GatewayConfigurationStore configurationStore,
                                     CurrencyNormalizer currencyNormalizer,
                                     String callbackBaseUrl) {
        this.configurationStore = configurationStore;
        this.currencyNormalizer = currencyNormalizer;
        this.callbackBaseUrl = stripTrailingSlash(callbackBaseUrl);
    }

    /** Used when the settings do not name a settlement currency. */
    protected abstract String defaultSettlementCurrency();

    /** Used when the settings do not name an exchange-rate country. */
    protected abstract String defaultExchangeRateCountry();

    @Override
    public GatewayRequest prepare(NormalizedPaymentRequest request) {
        GatewayCode code = getGatewayCode();
        GatewaySettings settings = configurationStore.requireSettings(code);
        if (isBlank(settings.getMerchantKey()) || isBlank(settings.getSecretKey())) {
            throw new GatewayConfigurationException("Merchant key or salt not configured for " + code.getCode());
        }
        String baseUrl = settings.resolveBaseUrl();
        if (isBlank(baseUrl)) {
            throw new GatewayConfigurationException("Payment URL not configured for " + code.getCode());
        }
        CustomerInfo customer = request.getCustomer();
        if (customer == null || isBlank(customer.getEmail())) {
            throw new PaymentValidationException("Customer email is required for " + code.getCode());
        }

        String settlementCurrency = currencyNormalizer.normalizeCode(
                isBlank(settings.getSettlementCurrency()) ? defaultSettlementCurrency() : settings.getSettlementCurrency());
        String requestedCurrency = currencyNormalizer.normalizeCode(request.getCurrency());
        BigDecimal rate = resolveRate(settings, requestedCurrency, settlementCurrency);

        BigDecimal charged = currencyNormalizer.roundToCurrency(request.getAmount().multiply(rate), settlementCurrency);
        BigDecimal minimum = settings.getMinimumAmount() != null ? settings.getMinimumAmount() : DEFAULT_MINIMUM;
        if (charged.compareTo(minimum) < 0) {
            throw new PaymentValidationException(ErrorKind.AMOUNT_TOO_SMALL,
                    "Amount below minimum for " + code.getCode() + ": " + charged + " " + settlementCurrency);
        }

        String amount = CurrencyNormalizer.formatTwoDecimals(charged);
        String productInfo = PiiMasker.truncate(
                isBlank(request.getDescription()) ? DEFAULT_PRODUCT_INFO : request.getDescription(), PRODUCT_INFO_MAX - 3);
        String firstName = customer.firstNameOr("Customer");
        List<String> userFields = List.of(
                nullToEmpty(request.getGuestSessionToken()),
                OrderReference.encode(request.getQuoteIds()),
                "", "", "");

        HashFields hashFields = HashFields.builder()
                .key(settings.getMerchantKey())
                .txnid(request.getTransactionId())
                .amount(amount)
                .productInfo(productInfo)
                .firstName(firstName)
                .email(customer.getEmail())
                .userFields(userFields)
                .build();

        String returnUrl = callbackBaseUrl + RETURN_PATH + code.getCode();
        LinkedHashMap<String, String> form = new LinkedHashMap<>();
        form.put("key", settings.getMerchantKey());
        form.put("txnid", request.getTransactionId());
        form.put("amount", amount);
        form.put("productinfo", productInfo);
        form.put("firstname", firstName);
        form.put("email", customer.getEmail());
        form.put("phone", nullToEmpty(customer.getPhone()));
        form.put("surl", returnUrl);
        form.put("furl", returnUrl);
        for (int i = 1; i <= RegionalHashScheme.USER_FIELD_COUNT; i++) {
            form.put("udf" + i, hashFields.userField(i));
        }
        form.put("hash", RegionalHashScheme.requestHash(hashFields, settings.getSecretKey()));
        form.put("hash_v2", RegionalHashScheme.requestHashV2(hashFields, settings.getSecretKey()));

        return HashFormRequest.builder()
                .gatewayCode(code)
                .transactionId(request.getTransactionId())
                .actionUrl(stripTrailingSlash(baseUrl) + PAYMENT_PATH)
                .formFields(form)
                .chargedAmount(charged)
                .chargedCurrency(settlementCurrency)
                .chargedAmountMinor(currencyNormalizer.toMinorUnits(charged, settlementCurrency))
                .requestedAmount(request.getAmount())
                .requestedCurrency(requestedCurrency)
                .exchangeRate(rate)
                .build();
    }

    @Override
    public PaymentCreationResult submit(GatewayRequest gatewayRequest) {
        HashFormRequest form = GatewayRequest.narrow(gatewayRequest, HashFormRequest.class);
        log.info("Hash form prepared: gateway={}, transactionId={}, amount={} {}",
                form.getGatewayCode().getCode(), form.getTransactionId(), form.getChargedAmount(), form.getChargedCurrency());

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("action_url", form.getActionUrl());
        audit.put("amount", form.getFormFields().get("amount"));
        audit.put("currency", form.getChargedCurrency());

        return PaymentCreationResult.builder()
                .success(true)
                .redirectUrl(form.getActionUrl())
                .formData(new LinkedHashMap<>(form.getFormFields()))
                .gatewayTransactionId(form.getTransactionId())
                .gatewayResponse(audit)
                .build();
    }

    private BigDecimal resolveRate(GatewaySettings settings, String requestedCurrency, String settlementCurrency) {
        if (requestedCurrency.equals(settlementCurrency)) {
            return BigDecimal.ONE;
        }
        if (!SOURCE_CURRENCY.equals(requestedCurrency)) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY,
                    getGatewayCode().getCode() + " accepts only " + SOURCE_CURRENCY + " or " + settlementCurrency
                            + ", got " + requestedCurrency);
        }
        String country = isBlank(settings.getExchangeRateCountry())
                ? defaultExchangeRateCountry() : settings.getExchangeRateCountry();
        BigDecimal rate = configurationStore.exchangeRateFromUsd(country)
                .orElseThrow(() -> new GatewayConfigurationException("No USD exchange rate configured for " + country));
        if (rate.signum() <= 0) {
            throw new GatewayConfigurationException("Invalid USD exchange rate for " + country + ": " + rate);
        }
        return rate;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.quotepay.payments.adapters;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.GatewayConfigurationException;
import com.quotepay.payments.api.GatewayException;
import com.quotepay.payments.api.PaymentValidationException;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.GatewayAdapter;
import com.quotepay.payments.core.currency.CurrencyNormalizer;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.NormalizedPaymentRequest;
import com.quotepay.payments.domain.OrderReference;
import com.quotepay.payments.domain.PaymentCreationResult;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.domain.gateway.WalletIntentRequest;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosted wallet checkout. Creates a payment intent with an OAuth bearer
 * token; when no token can be obtained, or the wallet rejects it, the call is
 * made once more with the client id and API key headers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HostedWalletAdapter implements GatewayAdapter {

    static final String CREATE_INTENT_PATH = "/api/v1/pa/payment_intents/create";
    static final String CLIENT_ID_HEADER = "x-client-id";
    static final String API_KEY_HEADER = "x-api-key";
    static final List<String> DEFAULT_CURRENCIES = List.of("USD", "EUR", "GBP", "AUD", "SGD", "HKD", "CNY", "JPY");
    private static final int DESCRIPTOR_MAX = 32;
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final GatewayConfigurationStore configurationStore;
    private final CurrencyNormalizer currencyNormalizer;
    private final WalletAccessTokenProvider tokenProvider;
    private final RestTemplate gatewayRestTemplate;

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.HOSTED_WALLET;
    }

    @Override
    public GatewayRequest prepare(NormalizedPaymentRequest request) {
        GatewaySettings settings = configurationStore.requireSettings(GatewayCode.HOSTED_WALLET);
        if (isBlank(settings.getClientId()) || isBlank(settings.getSecretKey()) || isBlank(settings.resolveBaseUrl())) {
            throw new GatewayConfigurationException("Hosted wallet client id, API key or base URL not configured");
        }
        String currency = currencyNormalizer.normalizeCode(request.getCurrency());
        List<String> supported = settings.getSupportedCurrencies().isEmpty()
                ? DEFAULT_CURRENCIES : settings.getSupportedCurrencies();
        if (!supported.contains(currency)) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY, "Currency not supported by hosted wallet: " + currency);
        }
        long amountMinor = currencyNormalizer.toMinorUnits(request.getAmount(), currency);
        BigDecimal charged = currencyNormalizer.fromMinorUnits(amountMinor, currency);
        if (amountMinor < 1 || (settings.getMinimumAmount() != null && charged.compareTo(settings.getMinimumAmount()) < 0)) {
            throw new PaymentValidationException(ErrorKind.AMOUNT_TOO_SMALL,
                    "Amount below hosted wallet minimum: " + charged + " " + currency);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("transaction_id", request.getTransactionId());
        metadata.put("order_reference", OrderReference.encode(request.getQuoteIds()));

        String descriptor = request.getDescription() == null ? "Quote payment" : request.getDescription();
        if (descriptor.length() > DESCRIPTOR_MAX) {
            descriptor = descriptor.substring(0, DESCRIPTOR_MAX);
        }

        return WalletIntentRequest.builder()
                .transactionId(request.getTransactionId())
                .chargedAmount(charged)
                .chargedCurrency(currency)
                .chargedAmountMinor(amountMinor)
                .merchantOrderId(request.getTransactionId())
                .descriptor(descriptor)
                .returnUrl(request.getSuccessUrl())
                .metadata(metadata)
                .settings(settings)
                .build();
    }

    @Override
    public PaymentCreationResult submit(GatewayRequest gatewayRequest) {
        WalletIntentRequest intent = GatewayRequest.narrow(gatewayRequest, WalletIntentRequest.class);
        GatewaySettings settings = intent.getSettings();
        Map<String, Object> body = requestBody(intent);

        Map<String, Object> response;
        String token = null;
        try {
            token = tokenProvider.accessToken(settings);
        } catch (WalletAuthenticationException e) {
            log.warn("Wallet OAuth unavailable, using API key headers: transactionId={}, reason={}",
                    intent.getTransactionId(), e.getMessage());
        }

        if (token != null) {
            try {
                response = createIntent(settings, body, bearerHeaders(token));
            } catch (HttpClientErrorException e) {
                if (e.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                    throw GatewayCallErrors.translate(GatewayCode.HOSTED_WALLET, "Create wallet intent", e);
                }
                log.warn("Wallet rejected bearer token, retrying with API key headers: transactionId={}",
                        intent.getTransactionId());
                tokenProvider.evict(settings);
                response = createWithApiKey(settings, body);
            } catch (RestClientException e) {
                throw GatewayCallErrors.translate(GatewayCode.HOSTED_WALLET, "Create wallet intent", e);
            }
        } else {
            response = createWithApiKey(settings, body);
        }

        String intentId = response == null ? null : GatewayCallErrors.stringValue(response.get("id"));
        if (intentId == null) {
            throw GatewayException.indeterminate(GatewayCode.HOSTED_WALLET,
                    "Wallet intent response without id: transactionId=" + intent.getTransactionId(), null);
        }
        String clientSecret = GatewayCallErrors.stringValue(response.get("client_secret"));
        String checkoutUrl = GatewayCallErrors.stringValue(response.get("checkout_url"));
        log.info("Wallet payment intent created: transactionId={}, intentId={}, amount={} {}",
                intent.getTransactionId(), intentId, intent.getChargedAmount(), intent.getChargedCurrency());

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("id", intentId);
        audit.put("status", response.get("status"));
        audit.put("amount", response.get("amount"));
        audit.put("currency", response.get("currency"));
        audit.put("merchant_order_id", response.get("merchant_order_id"));

        return PaymentCreationResult.builder()
                .success(true)
                .redirectUrl(checkoutUrl)
                .clientSecret(clientSecret)
                .gatewayTransactionId(intentId)
                .gatewayResponse(audit)
                .build();
    }

    private Map<String, Object> createWithApiKey(GatewaySettings settings, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CLIENT_ID_HEADER, settings.getClientId());
        headers.set(API_KEY_HEADER, settings.getSecretKey());
        try {
            return createIntent(settings, body, headers);
        } catch (RestClientException e) {
            throw GatewayCallErrors.translate(GatewayCode.HOSTED_WALLET, "Create wallet intent", e);
        }
    }

    private Map<String, Object> createIntent(GatewaySettings settings, Map<String, Object> body, HttpHeaders headers) {
        ResponseEntity<Map<String, Object>> response = gatewayRestTemplate.exchange(
                settings.resolveBaseUrl() + CREATE_INTENT_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), MAP_TYPE);
        return response.getBody();
    }

    private static HttpHeaders bearerHeaders(String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(token);
        return headers;
    }

    private static Map<String, Object> requestBody(WalletIntentRequest intent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("request_id", intent.getTransactionId());
        body.put("amount", intent.getChargedAmount().toPlainString());
        body.put("currency", intent.getChargedCurrency());
        body.put("merchant_order_id", intent.getMerchantOrderId());
        body.put("descriptor", intent.getDescriptor());
        if (intent.getReturnUrl() != null) {
            body.put("return_url", intent.getReturnUrl());
        }
        body.put("metadata", intent.getMetadata());
        return body;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

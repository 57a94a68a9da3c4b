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
import com.quotepay.payments.domain.gateway.CardIntentRequest;
import com.quotepay.payments.domain.gateway.GatewayRequest;
import com.quotepay.payments.integration.GatewayConfigurationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Card processor with payment intents: creates an intent server-side and
 * hands its client secret to the browser for confirmation. The transaction
 * id is sent as the idempotency key and in the intent metadata, which is
 * how callbacks find their ledger row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CardProcessorAdapter implements GatewayAdapter {

    static final String INTENTS_PATH = "/v1/payment_intents";
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};

    private final GatewayConfigurationStore configurationStore;
    private final CurrencyNormalizer currencyNormalizer;
    private final RestTemplate gatewayRestTemplate;

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.CARD;
    }

    @Override
    public GatewayRequest prepare(NormalizedPaymentRequest request) {
        GatewaySettings settings = configurationStore.requireSettings(GatewayCode.CARD);
        if (isBlank(settings.getSecretKey()) || isBlank(settings.resolveBaseUrl())) {
            throw new GatewayConfigurationException("Card processor secret key or API base URL not configured");
        }
        String currency = currencyNormalizer.normalizeCode(request.getCurrency());
        if (!settings.getSupportedCurrencies().isEmpty() && !settings.getSupportedCurrencies().contains(currency)) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY, "Currency not supported by card processor: " + currency);
        }
        long amountMinor = currencyNormalizer.toMinorUnits(request.getAmount(), currency);
        BigDecimal charged = currencyNormalizer.fromMinorUnits(amountMinor, currency);
        if (amountMinor < 1 || (settings.getMinimumAmount() != null && charged.compareTo(settings.getMinimumAmount()) < 0)) {
            throw new PaymentValidationException(ErrorKind.AMOUNT_TOO_SMALL,
                    "Amount below card processor minimum: " + charged + " " + currency);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("transaction_id", request.getTransactionId());
        metadata.put("order_reference", OrderReference.encode(request.getQuoteIds()));
        if (request.getUserId() != null) {
            metadata.put("user_id", request.getUserId());
        }
        metadata.put("guest_checkout", Boolean.toString(request.getGuestSessionToken() != null));

        return CardIntentRequest.builder()
                .transactionId(request.getTransactionId())
                .chargedAmount(charged)
                .chargedCurrency(currency)
                .chargedAmountMinor(amountMinor)
                .description(request.getDescription())
                .receiptEmail(request.getCustomer() != null ? request.getCustomer().getEmail() : null)
                .metadata(metadata)
                .settings(settings)
                .build();
    }

    @Override
    public PaymentCreationResult submit(GatewayRequest gatewayRequest) {
        CardIntentRequest intent = GatewayRequest.narrow(gatewayRequest, CardIntentRequest.class);
        GatewaySettings settings = intent.getSettings();

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", Long.toString(intent.getChargedAmountMinor()));
        form.add("currency", intent.getChargedCurrency().toLowerCase(Locale.ROOT));
        form.add("automatic_payment_methods[enabled]", "true");
        if (intent.getDescription() != null) {
            form.add("description", intent.getDescription());
        }
        if (intent.getReceiptEmail() != null) {
            form.add("receipt_email", intent.getReceiptEmail());
        }
        intent.getMetadata().forEach((k, v) -> form.add("metadata[" + k + "]", v));

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(settings.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.set("Idempotency-Key", intent.getTransactionId());

        ResponseEntity<Map<String, Object>> response;
        try {
            response = gatewayRestTemplate.exchange(settings.resolveBaseUrl() + INTENTS_PATH,
                    HttpMethod.POST, new HttpEntity<>(form, headers), MAP_TYPE);
        } catch (RestClientException e) {
            throw GatewayCallErrors.translate(GatewayCode.CARD, "Create payment intent", e);
        }

        Map<String, Object> body = response.getBody();
        String intentId = body == null ? null : GatewayCallErrors.stringValue(body.get("id"));
        String clientSecret = body == null ? null : GatewayCallErrors.stringValue(body.get("client_secret"));
        if (intentId == null || clientSecret == null) {
            throw GatewayException.indeterminate(GatewayCode.CARD,
                    "Payment intent response without id or client_secret: transactionId=" + intent.getTransactionId(), null);
        }
        log.info("Card payment intent created: transactionId={}, intentId={}, amountMinor={}, currency={}",
                intent.getTransactionId(), intentId, intent.getChargedAmountMinor(), intent.getChargedCurrency());

        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("id", intentId);
        audit.put("status", body.get("status"));
        audit.put("amount", body.get("amount"));
        audit.put("currency", body.get("currency"));
        audit.put("livemode", body.get("livemode"));

        return PaymentCreationResult.builder()
                .success(true)
                .clientSecret(clientSecret)
                .gatewayTransactionId(intentId)
                .gatewayResponse(audit)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

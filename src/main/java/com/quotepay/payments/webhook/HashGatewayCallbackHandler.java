package com.quotepay.payments.webhook;

import com.quotepay.payments.api.SignatureVerificationException;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.crypto.HashFields;
import com.quotepay.payments.core.crypto.KeyedHash;
import com.quotepay.payments.core.crypto.RegionalHashScheme;
import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import com.quotepay.payments.domain.OrderReference;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Form callbacks of the regional hash gateways, posted both server-to-server
 * and through the browser return. Event id is {@code txnid_status}, so the
 * two deliveries of one outcome deduplicate against each other.
 * <p>
 * udf1 carries the guest session token, udf2 the order reference.
 */
@Slf4j
public abstract class HashGatewayCallbackHandler implements GatewayCallbackHandler {

    @Override
    public CallbackResult parse(InboundCallback callback) {
        Map<String, String> params = callback.formParams();
        String txnid = trimToNull(params.get("txnid"));
        String status = trimToNull(params.get("status"));
        if (txnid == null || status == null) {
            throw new CallbackParseException("Hash gateway callback without txnid or status");
        }
        String normalizedStatus = status.toLowerCase(Locale.ROOT);

        Map<String, Object> details = new LinkedHashMap<>();
        putIfPresent(details, "gateway_payment_id", params.get("mihpayid"));
        putIfPresent(details, "mode", params.get("mode"));
        putIfPresent(details, "error_message", params.get("error_Message"));

        CallbackResult.CallbackResultBuilder builder = CallbackResult.builder()
                .gatewayCode(getGatewayCode())
                .eventId(txnid + "_" + normalizedStatus)
                .eventType(normalizedStatus)
                .outcome(outcomeOf(normalizedStatus))
                .transactionId(txnid)
                .gatewayTransactionId(txnid)
                .amount(trimToNull(params.get("amount")))
                .details(details);

        String reference = trimToNull(params.get("udf2"));
        if (reference == null) {
            builder.quoteIds(List.of());
        } else {
            Optional<List<String>> quoteIds = OrderReference.parse(reference);
            if (quoteIds.isPresent()) {
                builder.quoteIds(quoteIds.get());
            } else {
                log.warn("Unparseable order reference in {} callback: txnid={}", getGatewayCode().getCode(), txnid);
                builder.quoteIds(List.of()).referenceError(SignedJsonCallbackHandler.UNPARSEABLE_REFERENCE);
            }
        }
        return builder.build();
    }

    /**
     * Recomputes the reverse-order response hash with the merchant salt.
     * Comparison ignores case and surrounding whitespace.
     */
    @Override
    public void verify(InboundCallback callback, GatewaySettings settings, Instant now) {
        if (settings.getSecretKey() == null || settings.getSecretKey().isBlank()) {
            throw new SignatureVerificationException("Salt not configured for " + getGatewayCode().getCode());
        }
        Map<String, String> params = callback.formParams();
        String provided = params.get("hash");
        if (provided == null || provided.isBlank()) {
            throw new SignatureVerificationException("Callback without hash");
        }
        List<String> userFields = new ArrayList<>();
        for (int i = 1; i <= RegionalHashScheme.USER_FIELD_COUNT; i++) {
            userFields.add(nullToEmpty(params.get("udf" + i)));
        }
        HashFields fields = HashFields.builder()
                .key(nullToEmpty(params.get("key")))
                .txnid(nullToEmpty(params.get("txnid")))
                .amount(nullToEmpty(params.get("amount")))
                .productInfo(nullToEmpty(params.get("productinfo")))
                .firstName(nullToEmpty(params.get("firstname")))
                .email(nullToEmpty(params.get("email")))
                .userFields(userFields)
                .build();
        String expected = RegionalHashScheme.responseHash(fields, nullToEmpty(params.get("status")), settings.getSecretKey());
        if (!KeyedHash.hexEqualsIgnoreCase(expected, provided)) {
            throw new SignatureVerificationException("Response hash mismatch for txnid=" + params.get("txnid"));
        }
        if (settings.getMerchantKey() != null && !settings.getMerchantKey().equals(params.get("key"))) {
            throw new SignatureVerificationException("Callback merchant key does not match configuration");
        }
    }

    static CallbackOutcome outcomeOf(String status) {
        switch (status) {
            case "success":
                return CallbackOutcome.SUCCEEDED;
            case "failure":
            case "failed":
            case "cancel":
            case "cancelled":
                return CallbackOutcome.FAILED;
            case "pending":
                return CallbackOutcome.PENDING;
            default:
                return CallbackOutcome.IGNORED;
        }
    }

    private static void putIfPresent(Map<String, Object> details, String key, String value) {
        if (value != null && !value.isBlank()) {
            details.put(key, value);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

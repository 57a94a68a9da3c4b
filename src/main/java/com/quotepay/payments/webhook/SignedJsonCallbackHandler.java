package com.quotepay.payments.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotepay.payments.api.SignatureVerificationException;
import com.quotepay.payments.config.PaymentGatewayProperties.GatewaySettings;
import com.quotepay.payments.core.crypto.TimestampedSignature;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.OrderReference;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JSON event callbacks signed with a timestamped HMAC header. Subclasses
 * map their gateway's event shape.
 */
public abstract class SignedJsonCallbackHandler implements GatewayCallbackHandler {

    static final String UNPARSEABLE_REFERENCE = "unparseable_reference";

    private final ObjectMapper objectMapper;

    protected SignedJsonCallbackHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected abstract String defaultSignatureHeader();

    protected abstract CallbackResult map(JsonNode root);

    @Override
    public CallbackResult parse(InboundCallback callback) {
        if (callback.getRawBody() == null || callback.getRawBody().isBlank()) {
            throw new CallbackParseException("Empty callback body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(callback.getRawBody());
        } catch (JsonProcessingException e) {
            throw new CallbackParseException("Callback body is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CallbackParseException("Callback body is not a JSON object");
        }
        return map(root);
    }

    @Override
    public void verify(InboundCallback callback, GatewaySettings settings, Instant now) {
        if (settings.getWebhookSecret() == null || settings.getWebhookSecret().isBlank()) {
            throw new SignatureVerificationException("Webhook secret not configured for " + getGatewayCode().getCode());
        }
        String headerName = settings.getSignatureHeader() == null || settings.getSignatureHeader().isBlank()
                ? defaultSignatureHeader() : settings.getSignatureHeader();
        TimestampedSignature.verify(callback.header(headerName), settings.getWebhookSecret(), callback.getRawBody(),
                now, Duration.ofSeconds(settings.getSignatureToleranceSeconds()));
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    protected static String required(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new CallbackParseException("Callback without " + field);
        }
        return value;
    }

    /**
     * Applies the order reference to the builder: quote ids when it parses,
     * an error marker when it is present but malformed.
     */
    protected static CallbackResult.CallbackResultBuilder withReference(CallbackResult.CallbackResultBuilder builder,
                                                                        String reference) {
        if (reference == null || reference.isBlank()) {
            return builder.quoteIds(List.of());
        }
        Optional<List<String>> parsed = OrderReference.parse(reference);
        return parsed.isPresent()
                ? builder.quoteIds(parsed.get())
                : builder.quoteIds(List.of()).referenceError(UNPARSEABLE_REFERENCE);
    }
}

package com.quotepay.payments.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Card processor events ({@code payment_intent.*}). Our transaction id and
 * order reference come back in the intent metadata.
 */
@Component
public class CardCallbackHandler extends SignedJsonCallbackHandler {

    public CardCallbackHandler(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.CARD;
    }

    @Override
    protected String defaultSignatureHeader() {
        return "Stripe-Signature";
    }

    @Override
    protected CallbackResult map(JsonNode root) {
        String eventId = required(root, "id");
        String type = required(root, "type");
        JsonNode object = root.path("data").path("object");
        JsonNode metadata = object.path("metadata");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("intent_status", text(object, "status"));
        String failureCode = text(object.path("last_payment_error"), "code");
        if (failureCode != null) {
            details.put("failure_code", failureCode);
        }
        details.values().removeIf(v -> v == null);

        CallbackResult.CallbackResultBuilder builder = CallbackResult.builder()
                .gatewayCode(GatewayCode.CARD)
                .eventId(eventId)
                .eventType(type)
                .outcome(outcomeOf(type))
                .transactionId(text(metadata, "transaction_id"))
                .gatewayTransactionId(text(object, "id"))
                .amount(text(object, "amount"))
                .currency(text(object, "currency"))
                .details(details);
        return withReference(builder, text(metadata, "order_reference")).build();
    }

    static CallbackOutcome outcomeOf(String type) {
        switch (type) {
            case "payment_intent.succeeded":
                return CallbackOutcome.SUCCEEDED;
            case "payment_intent.payment_failed":
            case "payment_intent.canceled":
                return CallbackOutcome.FAILED;
            case "payment_intent.processing":
            case "payment_intent.requires_action":
                return CallbackOutcome.PENDING;
            default:
                return CallbackOutcome.IGNORED;
        }
    }
}

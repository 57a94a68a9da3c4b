package com.quotepay.payments.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotepay.payments.domain.CallbackOutcome;
import com.quotepay.payments.domain.CallbackResult;
import com.quotepay.payments.domain.GatewayCode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Hosted wallet events. The merchant order id is our transaction id.
 */
@Component
public class HostedWalletCallbackHandler extends SignedJsonCallbackHandler {

    public HostedWalletCallbackHandler(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public GatewayCode getGatewayCode() {
        return GatewayCode.HOSTED_WALLET;
    }

    @Override
    protected String defaultSignatureHeader() {
        return "x-airwallex-signature";
    }

    @Override
    protected CallbackResult map(JsonNode root) {
        String eventId = required(root, "id");
        String name = required(root, "name");
        JsonNode object = root.path("data").path("object");

        Map<String, Object> details = new LinkedHashMap<>();
        String status = text(object, "status");
        if (status != null) {
            details.put("intent_status", status);
        }

        CallbackResult.CallbackResultBuilder builder = CallbackResult.builder()
                .gatewayCode(GatewayCode.HOSTED_WALLET)
                .eventId(eventId)
                .eventType(name)
                .outcome(outcomeOf(name))
                .transactionId(text(object, "merchant_order_id"))
                .gatewayTransactionId(text(object, "id"))
                .amount(text(object, "amount"))
                .currency(text(object, "currency"))
                .details(details);
        return withReference(builder, text(object.path("metadata"), "order_reference")).build();
    }

    static CallbackOutcome outcomeOf(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".succeeded")) {
            return CallbackOutcome.SUCCEEDED;
        }
        if (lower.endsWith(".failed") || lower.endsWith(".cancelled") || lower.endsWith(".canceled")) {
            return CallbackOutcome.FAILED;
        }
        if (lower.endsWith(".requires_capture") || lower.endsWith(".pending")) {
            return CallbackOutcome.PENDING;
        }
        return CallbackOutcome.IGNORED;
    }
}

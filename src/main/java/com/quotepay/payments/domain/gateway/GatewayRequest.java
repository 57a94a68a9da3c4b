package com.quotepay.payments.domain.gateway;

import com.quotepay.payments.domain.GatewayCode;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Prepared, gateway-specific request produced by an adapter's prepare step.
 * One implementation per gateway family; {@link #getGatewayCode()} is the tag.
 */
public interface GatewayRequest {

    GatewayCode getGatewayCode();

    String getTransactionId();

    /** Amount the gateway will charge, in {@link #getChargedCurrency()}. */
    BigDecimal getChargedAmount();

    String getChargedCurrency();

    long getChargedAmountMinor();

    /** Conversion and other details recorded on the ledger row. */
    default Map<String, Object> getAuditDetails() {
        return Map.of();
    }

    static <T extends GatewayRequest> T narrow(GatewayRequest request, Class<T> type) {
        if (!type.isInstance(request)) {
            throw new IllegalArgumentException("Expected " + type.getSimpleName() + " but got "
                    + (request == null ? "null" : request.getClass().getSimpleName()));
        }
        return type.cast(request);
    }
}

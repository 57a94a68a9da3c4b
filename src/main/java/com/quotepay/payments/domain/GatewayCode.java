package com.quotepay.payments.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Gateways a checkout can be paid through. The code doubles as the public
 * wire value and as the configuration key under {@code payment.gateways}.
 */
public enum GatewayCode {

    CARD("card", "CRD", false),
    REGIONAL_HASH_A("regional-hash-a", "RHA", false),
    REGIONAL_HASH_B("regional-hash-b", "RHB", false),
    HOSTED_WALLET("hosted-wallet", "HWL", false),
    BANK_TRANSFER("bank-transfer", "BNK", true),
    CASH_ON_DELIVERY("cash-on-delivery", "COD", true);

    private final String code;
    private final String transactionPrefix;
    private final boolean manual;

    GatewayCode(String code, String transactionPrefix, boolean manual) {
        this.code = code;
        this.transactionPrefix = transactionPrefix;
        this.manual = manual;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTransactionPrefix() {
        return transactionPrefix;
    }

    /** Manual methods have no external gateway leg (no intent, no callback). */
    public boolean isManual() {
        return manual;
    }

    /**
     * Resolves a gateway from its wire code or enum name, ignoring case and
     * treating '_' and '-' alike.
     */
    public static Optional<GatewayCode> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(g -> g.code.equals(normalized))
                .findFirst();
    }
}

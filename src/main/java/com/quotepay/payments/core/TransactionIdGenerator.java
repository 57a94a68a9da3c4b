package com.quotepay.payments.core;

import com.quotepay.payments.domain.GatewayCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Caller-visible transaction ids: {@code <prefix>_<epochMillis>_<6 random>},
 * at most 24 characters so hash gateways accept them as txnid.
 */
@Component
@RequiredArgsConstructor
public class TransactionIdGenerator {

    private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int SUFFIX_LENGTH = 6;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public String next(GatewayCode gatewayCode) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return gatewayCode.getTransactionPrefix() + "_" + clock.millis() + "_" + suffix;
    }
}

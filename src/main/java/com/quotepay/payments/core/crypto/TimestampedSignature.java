package com.quotepay.payments.core.crypto;

import com.quotepay.payments.api.SignatureVerificationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code t=<unix seconds>,v1=<hex>} signature headers, where the signature is
 * HMAC-SHA256 of {@code <t>.<raw body>} under the webhook secret.
 */
public final class TimestampedSignature {

    private TimestampedSignature() {}

    public static String header(String secret, long epochSeconds, String body) {
        return "t=" + epochSeconds + ",v1=" + KeyedHash.hmacSha256Hex(secret, epochSeconds + "." + body);
    }

    /**
     * @throws SignatureVerificationException when the header is missing or
     *         malformed, the timestamp is outside {@code tolerance}, or no
     *         {@code v1} entry matches
     */
    public static void verify(String header, String secret, String body, Instant now, Duration tolerance) {
        if (header == null || header.isBlank()) {
            throw new SignatureVerificationException("Signature header missing");
        }
        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String element : header.split(",")) {
            int eq = element.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = element.substring(0, eq).trim();
            String value = element.substring(eq + 1).trim();
            if ("t".equals(name)) {
                try {
                    timestamp = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new SignatureVerificationException("Signature timestamp is not numeric");
                }
            } else if ("v1".equals(name)) {
                signatures.add(value);
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw new SignatureVerificationException("Signature header malformed");
        }
        long skew = Math.abs(now.getEpochSecond() - timestamp);
        if (skew > tolerance.getSeconds()) {
            throw new SignatureVerificationException("Signature timestamp outside tolerance: skewSeconds=" + skew);
        }
        String expected = KeyedHash.hmacSha256Hex(secret, timestamp + "." + body);
        boolean matched = signatures.stream().anyMatch(s -> KeyedHash.hexEqualsIgnoreCase(expected, s));
        if (!matched) {
            throw new SignatureVerificationException("Signature mismatch");
        }
    }
}

package com.quotepay.payments.core.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Digest and HMAC helpers shared by outbound request signing and inbound
 * callback verification. All digests are lowercase hex.
 */
public final class KeyedHash {

    public static final String PIPE = "|";

    private static final HexFormat HEX = HexFormat.of();

    private KeyedHash() {}

    /**
     * SHA-512 over the fields joined by {@code delimiter}, in order.
     * Null fields count as empty.
     */
    public static String sha512Hex(List<String> fields, String delimiter) {
        String material = fields.stream()
                .map(f -> f == null ? "" : f)
                .collect(Collectors.joining(delimiter));
        return HEX.formatHex(digest("SHA-512", material));
    }

    public static String sha256Hex(String payload) {
        return HEX.formatHex(digest("SHA-256", payload == null ? "" : payload));
    }

    public static String hmacSha256Hex(String secret, String message) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HEX.formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * Constant-time comparison of two hex digests, ignoring case and
     * surrounding whitespace.
     */
    public static boolean hexEqualsIgnoreCase(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        byte[] a = expected.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        byte[] b = provided.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(a, b);
    }

    private static byte[] digest(String algorithm, String material) {
        try {
            return MessageDigest.getInstance(algorithm).digest(material.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " unavailable", e);
        }
    }
}

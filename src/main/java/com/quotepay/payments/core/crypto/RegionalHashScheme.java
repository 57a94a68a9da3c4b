package com.quotepay.payments.core.crypto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Field order of the SHA-512 hashes used by the regional hash gateways.
 * <p>
 * Request: {@code key|txnid|amount|productinfo|firstname|email|udf1..udf5|||||salt}<br>
 * Response: {@code salt|status|||||udf5..udf1|email|firstname|productinfo|amount|txnid|key}
 */
public final class RegionalHashScheme {

    public static final int USER_FIELD_COUNT = 5;
    private static final int RESERVED_FIELD_COUNT = 5;

    private RegionalHashScheme() {}

    public static String requestHash(HashFields fields, String salt) {
        return KeyedHash.sha512Hex(requestSequence(fields, true, salt), KeyedHash.PIPE);
    }

    /**
     * Secondary variant: reversed salt and blank user fields, accepted by
     * the counterpart service's alternate validator.
     */
    public static String requestHashV2(HashFields fields, String salt) {
        String reversed = new StringBuilder(salt).reverse().toString();
        return KeyedHash.sha512Hex(requestSequence(fields, false, reversed), KeyedHash.PIPE);
    }

    public static String responseHash(HashFields fields, String status, String salt) {
        return KeyedHash.sha512Hex(responseSequence(fields, status, salt), KeyedHash.PIPE);
    }

    static List<String> requestSequence(HashFields fields, boolean includeUserFields, String salt) {
        List<String> sequence = new ArrayList<>();
        sequence.add(fields.getKey());
        sequence.add(fields.getTxnid());
        sequence.add(fields.getAmount());
        sequence.add(fields.getProductInfo());
        sequence.add(fields.getFirstName());
        sequence.add(fields.getEmail());
        for (int i = 1; i <= USER_FIELD_COUNT; i++) {
            sequence.add(includeUserFields ? fields.userField(i) : "");
        }
        sequence.addAll(Collections.nCopies(RESERVED_FIELD_COUNT, ""));
        sequence.add(salt);
        return sequence;
    }

    static List<String> responseSequence(HashFields fields, String status, String salt) {
        List<String> sequence = new ArrayList<>();
        sequence.add(salt);
        sequence.add(status);
        sequence.addAll(Collections.nCopies(RESERVED_FIELD_COUNT, ""));
        for (int i = USER_FIELD_COUNT; i >= 1; i--) {
            sequence.add(fields.userField(i));
        }
        sequence.add(fields.getEmail());
        sequence.add(fields.getFirstName());
        sequence.add(fields.getProductInfo());
        sequence.add(fields.getAmount());
        sequence.add(fields.getTxnid());
        sequence.add(fields.getKey());
        return sequence;
    }
}

package com.quotepay.payments.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Encoding of the quote ids carried through a gateway in its reference
 * field: {@code Order_Q1,Q2}. Parsing also accepts the bare list.
 */
public final class OrderReference {

    public static final String PREFIX = "Order_";
    private static final String DELIMITER = ",";
    private static final Pattern QUOTE_ID = Pattern.compile("[A-Za-z0-9_\\-]{1,64}");

    private OrderReference() {}

    public static String encode(List<String> quoteIds) {
        if (quoteIds == null || quoteIds.isEmpty()) {
            throw new IllegalArgumentException("quoteIds must not be empty");
        }
        return PREFIX + String.join(DELIMITER, quoteIds);
    }

    /**
     * Returns the quote ids, or empty when the reference is missing or any
     * element is not a plausible quote id.
     */
    public static Optional<List<String>> parse(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String body = reference.trim();
        if (body.startsWith(PREFIX)) {
            body = body.substring(PREFIX.length());
        }
        List<String> ids = Arrays.stream(body.split(DELIMITER))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
        if (ids.isEmpty() || !ids.stream().allMatch(id -> QUOTE_ID.matcher(id).matches())) {
            return Optional.empty();
        }
        return Optional.of(ids);
    }
}

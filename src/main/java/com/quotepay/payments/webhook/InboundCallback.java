package com.quotepay.payments.webhook;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A callback exactly as it arrived: raw body for signature checks, headers,
 * and form parameters when the gateway posted a form.
 */
@Value
@Builder
public class InboundCallback {

    String rawBody;

    @Singular
    Map<String, String> headers;

    @Singular
    Map<String, String> params;

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Form parameters, decoded from the raw body when the container did not
     * bind them.
     */
    public Map<String, String> formParams() {
        if (!params.isEmpty() || rawBody == null || rawBody.isBlank()) {
            return params;
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String pair : rawBody.split("&")) {
            String[] parts = pair.split("=", 2);
            if (parts[0].isEmpty()) {
                continue;
            }
            String key = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            String value = parts.length == 2 ? URLDecoder.decode(parts[1], StandardCharsets.UTF_8) : "";
            parsed.put(key, value);
        }
        return parsed;
    }

    /** Canonical {@code k=v&...} rendering of bound form parameters, used as the stored payload. */
    public static String canonicalForm(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        params.forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(k).append('=').append(v == null ? "" : v);
        });
        return sb.toString();
    }
}

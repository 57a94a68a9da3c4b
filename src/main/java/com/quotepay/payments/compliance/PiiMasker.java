package com.quotepay.payments.compliance;

/**
 * Redacts customer data so it is safe to include in logs.
 */
public final class PiiMasker {

    private PiiMasker() {}

    /** {@code john.doe@example.com -> jo***@example.com} */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";
        String local = email.substring(0, at);
        String visible = local.length() <= 2 ? local.substring(0, 1) : local.substring(0, 2);
        return visible + "***" + email.substring(at);
    }

    /** Keeps the last two digits. */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) return null;
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() <= 2) return "***";
        return "***" + digits.substring(digits.length() - 2);
    }

    /** {@code Jane Doe -> J***} */
    public static String maskName(String name) {
        if (name == null || name.isBlank()) return null;
        return name.trim().charAt(0) + "***";
    }

    /** Tokens and session ids: first four characters only. */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) return null;
        return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) return value;
        return value.substring(0, maxLength) + "...";
    }
}

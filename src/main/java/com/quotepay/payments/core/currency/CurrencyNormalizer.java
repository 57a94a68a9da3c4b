package com.quotepay.payments.core.currency;

import com.quotepay.payments.api.ErrorKind;
import com.quotepay.payments.api.PaymentValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts decimal amounts to the integer smallest-unit representation
 * gateways expect, and back. Rounding is half-up.
 */
@Component
public class CurrencyNormalizer {

    private static final Pattern ISO_CODE = Pattern.compile("[A-Z]{3}");

    /** Includes the African zero-decimal currencies card processors charge without minor units. */
    static final Set<String> ZERO_DECIMAL = Set.of(
            "BIF", "CLP", "DJF", "GNF", "ISK", "JPY", "KMF", "KRW", "MGA",
            "PYG", "RWF", "UGX", "VND", "VUV", "XAF", "XOF", "XPF");

    static final Set<String> THREE_DECIMAL = Set.of("BHD", "JOD", "KWD", "OMR", "TND");

    /**
     * Upper-cases and validates an ISO 4217 code.
     *
     * @throws PaymentValidationException with {@link ErrorKind#INVALID_CURRENCY}
     */
    public String normalizeCode(String currency) {
        if (currency == null) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY, "Currency is required");
        }
        String code = currency.trim().toUpperCase(Locale.ROOT);
        if (!ISO_CODE.matcher(code).matches()) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY, "Malformed currency code: " + currency);
        }
        try {
            Currency.getInstance(code);
        } catch (IllegalArgumentException e) {
            throw new PaymentValidationException(ErrorKind.INVALID_CURRENCY, "Unknown currency code: " + code);
        }
        return code;
    }

    public DecimalClass decimalClass(String currency) {
        String code = normalizeCode(currency);
        if (ZERO_DECIMAL.contains(code)) {
            return DecimalClass.ZERO;
        }
        if (THREE_DECIMAL.contains(code)) {
            return DecimalClass.THREE;
        }
        return DecimalClass.TWO;
    }

    public long toMinorUnits(BigDecimal amount, String currency) {
        if (amount == null) {
            throw new PaymentValidationException("Amount is required");
        }
        if (amount.signum() < 0) {
            throw new PaymentValidationException("Amount must not be negative");
        }
        DecimalClass decimalClass = decimalClass(currency);
        try {
            return amount.movePointRight(decimalClass.getDigits())
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new PaymentValidationException("Amount out of range: " + amount);
        }
    }

    public BigDecimal fromMinorUnits(long amountMinor, String currency) {
        DecimalClass decimalClass = decimalClass(currency);
        return BigDecimal.valueOf(amountMinor, decimalClass.getDigits());
    }

    /** Rounds a major amount to the precision the currency allows. */
    public BigDecimal roundToCurrency(BigDecimal amount, String currency) {
        return fromMinorUnits(toMinorUnits(amount, currency), currency);
    }

    /** Fixed two-decimal rendering used in hash material, e.g. {@code 12.80}. */
    public static String formatTwoDecimals(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}

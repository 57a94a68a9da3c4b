package com.quotepay.payments.core.currency;

/**
 * Number of minor-unit digits a gateway expects for a currency.
 */
public enum DecimalClass {

    ZERO(0),
    TWO(2),
    THREE(3);

    private final int digits;

    DecimalClass(int digits) {
        this.digits = digits;
    }

    public int getDigits() {
        return digits;
    }

    public long getMultiplier() {
        long multiplier = 1L;
        for (int i = 0; i < digits; i++) {
            multiplier *= 10L;
        }
        return multiplier;
    }
}

package com.jreinhal.assay.util;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Set;

public final class NumberFormats {

    private NumberFormats() {
    }

    /**
     * Plain decimal rendering without exponent or trailing zeros: 45.0 gives "45", 131.50 gives "131.5".
     */
    public static String plain(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }

    /**
     * The dot form and the locale-comma form of a value, e.g. {"131.5", "131,5"}.
     */
    public static Set<String> decimalVariants(double value) {
        Set<String> variants = new LinkedHashSet<>();
        String plain = plain(value);
        variants.add(plain);
        variants.add(plain.replace('.', ','));
        return variants;
    }

    /**
     * Parses a token written with either decimal separator. Returns {@code null} when it is not a number.
     */
    public static Double parseLenient(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(token.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

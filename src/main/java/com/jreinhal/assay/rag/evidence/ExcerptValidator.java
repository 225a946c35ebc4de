package com.jreinhal.assay.rag.evidence;

import com.jreinhal.assay.util.NumberFormats;
import java.util.regex.Pattern;

/**
 * A measurement is only usable as evidence when the excerpt it was extracted from literally shows
 * its value, written with a dot or a comma as decimal separator.
 */
public final class ExcerptValidator {

    private ExcerptValidator() {
    }

    public static boolean containsValue(String excerpt, Double value) {
        if (excerpt == null || excerpt.isBlank() || value == null || value.isNaN() || value.isInfinite()) {
            return false;
        }
        for (String form : NumberFormats.decimalVariants(Math.abs(value))) {
            boolean decimal = form.indexOf('.') >= 0 || form.indexOf(',') >= 0;
            // "131.5" also matches "131.50", "45" also matches "45.0"; "45" must not match "450" or "4.5"
            String padding = decimal ? "0*" : "(?:[.,]0+)?";
            String regex = "(?<![\\d.,])" + Pattern.quote(form) + padding + "(?![\\d]|[.,]\\d)";
            if (Pattern.compile(regex).matcher(excerpt).find()) {
                return true;
            }
        }
        return false;
    }
}

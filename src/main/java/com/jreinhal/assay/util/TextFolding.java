package com.jreinhal.assay.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case and accent folding shared by every component that compares user text with catalog text.
 */
public final class TextFolding {
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextFolding() {
    }

    /**
     * Lower-cases, strips diacritics and collapses whitespace. {@code "Resistência  Flexural"}
     * becomes {@code "resistencia flexural"}.
     */
    public static String fold(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}

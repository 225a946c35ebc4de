package com.jreinhal.assay.util;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Helpers that keep user-supplied text out of log output.
 *
 * <p>Queries are never logged verbatim: only their length and a short hash, so two log
 * lines about the same question can still be correlated.</p>
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_VALUE_LENGTH = 120;

    private LogSanitizer() {
    }

    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strips control characters so a value cannot forge extra log lines, and caps its length.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        if (cleaned.length() > MAX_VALUE_LENGTH) {
            return cleaned.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return cleaned;
    }

    public static String scopeSummary(Collection<String> projectIds) {
        if (projectIds == null || projectIds.isEmpty()) {
            return "[projects=0]";
        }
        return "[projects=" + projectIds.size() + "]";
    }
}

package com.jreinhal.legaldoc.util;

import java.util.regex.Pattern;

/**
 * Log-safe renderings of user-supplied values.
 */
public final class LogSanitizer {
    private static final Pattern LINE_BREAKS = Pattern.compile("\\R+");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\t]]");
    private static final int MAX_VALUE_CHARS = 200;

    private LogSanitizer() {
    }

    /**
     * Length, searchable term count and hash of a question. Legal questions can carry client
     * details, so the text itself never reaches the log.
     */
    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,terms=0,id=none]";
        }
        return "[len=" + query.length() + ",terms=" + TextTokenizer.terms(query).size()
                + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Flattens a filename, conversation id or error message onto one line and caps its length,
     * so a value cannot forge or flood log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String flat = CONTROL_CHARS.matcher(LINE_BREAKS.matcher(value).replaceAll(" ")).replaceAll("");
        return flat.length() <= MAX_VALUE_CHARS ? flat : flat.substring(0, MAX_VALUE_CHARS) + "...";
    }
}

package com.researchdesk.orchestrator.extract;

import java.util.regex.Pattern;

/**
 * Small text helpers shared by the extractor and the raw-data formatter.
 */
public final class TextUtils {

    public static final String TRUNCATION_NOTICE = "[Content truncated due to size limits]";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {}

    /**
     * Truncate to at most maxLength characters plus the truncation notice.
     * Cuts at a paragraph break when one exists in the second half of the
     * budget; text that already fits is returned unchanged.
     */
    public static String safeTruncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int searchEnd = Math.max(0, maxLength - 50);
        int lastBreak = text.substring(0, searchEnd).lastIndexOf("\n\n");
        if (lastBreak > maxLength / 2) {
            return text.substring(0, lastBreak) + "\n\n" + TRUNCATION_NOTICE;
        }
        return text.substring(0, maxLength) + "...\n" + TRUNCATION_NOTICE;
    }

    /** Collapse runs of whitespace into single spaces and trim. */
    public static String normalizeWhitespace(String text) {
        if (text == null || text.isBlank()) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String head(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }
}

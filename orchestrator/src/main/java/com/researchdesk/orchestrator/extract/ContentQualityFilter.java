package com.researchdesk.orchestrator.extract;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Rejects extracted text that is an error page, a wall (login, paywall,
 * captcha) or mostly navigation chrome rather than content.
 */
final class ContentQualityFilter {

    private static final int MIN_LENGTH = 50;
    private static final int MIN_MEANINGFUL_SENTENCES = 2;
    private static final int MEANINGFUL_SENTENCE_LENGTH = 20;
    private static final double MAX_UI_RATIO = 0.3;

    private static final List<String> ERROR_MARKERS = List.of(
            "javascript is disabled",
            "page restricted",
            "access denied",
            "403 forbidden",
            "404 not found",
            "503 service unavailable",
            "login required",
            "subscription required",
            "paywall",
            "please enable javascript",
            "cookies required",
            "captcha",
            "robot verification",
            "cloudflare",
            "enable cookies",
            "browser not supported",
            "content not available",
            "page not found",
            "unauthorized access",
            "permission denied");

    private static final List<String> UI_MARKERS = List.of(
            "skip to main content",
            "toggle navigation",
            "menu",
            "search",
            "login",
            "sign up",
            "cookie policy");

    private ContentQualityFilter() {}

    /** @return null if acceptable, otherwise the reason for rejection */
    static String rejectionReason(String content, String title, String description) {
        if (content == null || content.strip().length() < MIN_LENGTH) {
            return "content shorter than " + MIN_LENGTH + " characters";
        }

        String body = content.toLowerCase(Locale.ROOT);
        String head = ((title == null ? "" : title) + " " + (description == null ? "" : description))
                .toLowerCase(Locale.ROOT);
        for (String marker : ERROR_MARKERS) {
            if (body.contains(marker) || head.contains(marker)) {
                return "looks like a restricted or error page ('" + marker + "')";
            }
        }

        long uiHits = UI_MARKERS.stream().filter(body::contains).count();
        int words = content.split("\\s+").length;
        if (words > 0 && (double) uiHits / words > MAX_UI_RATIO) {
            return "mostly navigation elements";
        }

        long meaningful = Arrays.stream(content.split("\\."))
                .filter(s -> s.strip().length() > MEANINGFUL_SENTENCE_LENGTH)
                .count();
        if (meaningful < MIN_MEANINGFUL_SENTENCES) {
            return "fewer than " + MIN_MEANINGFUL_SENTENCES + " meaningful sentences";
        }
        return null;
    }
}

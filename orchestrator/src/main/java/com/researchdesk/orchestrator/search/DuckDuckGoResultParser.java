package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the DuckDuckGo HTML results page into {@link SourceHit}s.
 *
 * Pure parsing, no I/O.
 */
final class DuckDuckGoResultParser {

    private static final Pattern REDIRECT_TARGET = Pattern.compile("uddg=([^&]+)");
    private static final int MAX_TITLE = 100;
    private static final int MAX_URL   = 150;

    private DuckDuckGoResultParser() {}

    static List<SourceHit> parse(String html, int count, int snippetLength) {
        Document doc = Jsoup.parse(html);
        List<SourceHit> hits = new ArrayList<>();

        for (Element block : doc.select(".result")) {
            if (hits.size() >= count) break;

            Element link = block.selectFirst(".result__title a");
            if (link == null) continue;

            String title = link.text().trim();
            String href  = unwrapRedirect(link.attr("href"));
            if (href.isBlank()) continue;

            Element snippetElem = block.selectFirst(".result__snippet");
            String snippet = snippetElem != null ? snippetElem.text().trim() : "No snippet available";

            hits.add(new SourceHit(
                    truncate(title, MAX_TITLE),
                    truncate(href, MAX_URL),
                    truncate(snippet, snippetLength),
                    BackendKind.WEB));
        }
        return hits;
    }

    /**
     * Result links point at a duckduckgo.com redirect carrying the target in uddg=.
     * A target with a broken percent-escape yields "" so that result is skipped.
     */
    static String unwrapRedirect(String href) {
        if (href == null) return "";
        if (href.contains("duckduckgo.com")) {
            Matcher m = REDIRECT_TARGET.matcher(href);
            if (m.find()) {
                try {
                    return URLDecoder.decode(m.group(1), StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    return "";
                }
            }
        }
        if (href.startsWith("//")) {
            return "https:" + href;
        }
        return href;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}

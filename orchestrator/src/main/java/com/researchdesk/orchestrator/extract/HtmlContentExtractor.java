package com.researchdesk.orchestrator.extract;

import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.ExtractedContent;
import com.researchdesk.orchestrator.model.SourceHit;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ContentExtractor} for HTML pages, using Jsoup.
 *
 * Extraction order for the body text:
 *   1. the first max-paragraphs {@code <p>} elements longer than 15 chars
 *   2. if that yields fewer than two pieces, headings and paragraphs
 *   3. if still nothing, the whole body text
 *
 * Academic hits that carry an abstract are answered from the abstract
 * without touching the network.
 */
@Component
public class HtmlContentExtractor implements ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(HtmlContentExtractor.class);

    private static final int MAX_TITLE       = 100;
    private static final int MAX_DESCRIPTION = 200;
    private static final int MAX_PARAGRAPH   = 300;
    private static final int MAX_ELEMENT     = 200;
    private static final int MAX_FALLBACK    = 500;

    private final HttpClient http;
    private final ResearchProperties.Content settings;

    public HtmlContentExtractor(ResearchProperties properties) {
        this.settings = properties.getContent();
        this.http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // ContentExtractor
    // ------------------------------------------------------------------

    @Override
    public ExtractedContent extract(SourceHit hit) {
        String abstrakt = hit.meta(SourceHit.META_ABSTRACT);
        if (hit.backendKind() == BackendKind.ACADEMIC && abstrakt != null && !abstrakt.isBlank()) {
            String reason = ContentQualityFilter.rejectionReason(abstrakt, hit.title(), "");
            if (reason == null) {
                log.info("Using abstract for academic source {}", hit.url());
                return fromAbstract(hit, abstrakt);
            }
            log.warn("Abstract of {} rejected ({}), falling back to page extraction", hit.url(), reason);
        }
        if (hit.url() == null || hit.url().isBlank()) {
            throw new ExtractionException(hit.title(), ExtractionException.Kind.FETCH_FAILED,
                    "hit has no URL");
        }
        return extract(hit.url());
    }

    @Override
    public ExtractedContent extract(String url) {
        log.info("Extracting content from {}", url);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(settings.getTimeout())
                    .header("User-Agent", settings.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,text/plain;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED, "invalid URL", e);
        }

        HttpResponse<InputStream> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED,
                    "timed out after " + settings.getTimeout().toMillis() + " ms", e);
        } catch (IOException e) {
            throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED,
                    "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED, "interrupted", e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED,
                        "HTTP " + response.statusCode());
            }

            String contentType = response.headers().firstValue("content-type").orElse("text/html")
                    .toLowerCase(Locale.ROOT);
            if (contentType.contains("application/pdf")) {
                throw new ExtractionException(url, ExtractionException.Kind.UNSUPPORTED,
                        "PDF documents cannot be extracted");
            }
            boolean html = contentType.contains("html");
            if (!html && !contentType.startsWith("text/")) {
                throw new ExtractionException(url, ExtractionException.Kind.UNSUPPORTED,
                        "unsupported content type " + contentType);
            }

            long declared = response.headers().firstValueAsLong("content-length").orElse(-1L);
            if (declared > settings.getMaxExtractionSize()) {
                throw tooLarge(url, declared);
            }
            byte[] bytes = body.readNBytes(settings.getMaxExtractionSize() + 1);
            if (bytes.length > settings.getMaxExtractionSize()) {
                throw tooLarge(url, bytes.length);
            }

            String text = new String(bytes, charsetOf(contentType));
            return html ? fromHtml(url, text) : fromPlainText(url, text);
        } catch (IOException e) {
            throw new ExtractionException(url, ExtractionException.Kind.FETCH_FAILED,
                    "failed reading body: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Parsing (package-private for tests)
    // ------------------------------------------------------------------

    ExtractedContent fromHtml(String url, String html) {
        Document doc = Jsoup.parse(html, url);
        doc.select("script, style, noscript").remove();

        String title = doc.title().isBlank() ? "No title" : TextUtils.head(doc.title().strip(), MAX_TITLE);
        Element meta = doc.selectFirst("meta[name=description]");
        String description = meta != null && meta.hasAttr("content")
                ? TextUtils.head(meta.attr("content"), MAX_DESCRIPTION)
                : "No description available";
        String content = bodyText(doc);

        String reason = ContentQualityFilter.rejectionReason(content, title, description);
        if (reason != null) {
            throw new ExtractionException(url, ExtractionException.Kind.LOW_QUALITY, reason);
        }
        return new ExtractedContent(title, url, description,
                TextUtils.safeTruncate(content, settings.getMaxContentLength()), Instant.now());
    }

    ExtractedContent fromPlainText(String url, String text) {
        String content = TextUtils.normalizeWhitespace(text);
        String reason = ContentQualityFilter.rejectionReason(content, "", "");
        if (reason != null) {
            throw new ExtractionException(url, ExtractionException.Kind.LOW_QUALITY, reason);
        }
        return new ExtractedContent(url, url, "Plain text document",
                TextUtils.safeTruncate(content, settings.getMaxContentLength()), Instant.now());
    }

    private String bodyText(Document doc) {
        List<String> pieces = new ArrayList<>();

        List<Element> paragraphs = doc.select("p");
        for (int i = 0; i < paragraphs.size() && i < settings.getMaxParagraphs(); i++) {
            String text = paragraphs.get(i).text().strip();
            if (text.length() > 15) {
                pieces.add(TextUtils.head(text, MAX_PARAGRAPH));
            }
        }

        if (pieces.size() < 2) {
            List<Element> elements = doc.select("h1, h2, h3, p");
            for (int i = 0; i < elements.size() && i < settings.getMaxElements(); i++) {
                String text = elements.get(i).text().strip();
                if (text.length() > 10) {
                    pieces.add(TextUtils.head(text, MAX_ELEMENT));
                }
            }
        }

        if (pieces.isEmpty()) {
            String all = TextUtils.normalizeWhitespace(doc.body() != null ? doc.body().text() : doc.text());
            pieces.add(TextUtils.head(all, MAX_FALLBACK));
        }
        return String.join("\n\n", pieces);
    }

    private ExtractedContent fromAbstract(SourceHit hit, String abstrakt) {
        String authors = orDefault(hit.meta(SourceHit.META_AUTHORS), "Unknown authors");
        String year    = orDefault(hit.meta(SourceHit.META_YEAR), "Unknown year");
        String venue   = hit.meta(SourceHit.META_VENUE);

        StringBuilder sb = new StringBuilder()
                .append("Authors: ").append(authors).append('\n')
                .append("Year: ").append(year).append('\n');
        if (venue != null && !venue.isBlank()) {
            sb.append("Published in: ").append(venue).append('\n');
        }
        sb.append("\nAbstract:\n").append(abstrakt);

        return new ExtractedContent(hit.title(), hit.url(),
                "Academic paper by " + authors + " (" + year + ")",
                TextUtils.safeTruncate(sb.toString(), settings.getMaxContentLength()),
                Instant.now());
    }

    private ExtractionException tooLarge(String url, long size) {
        return new ExtractionException(url, ExtractionException.Kind.TOO_LARGE,
                "document exceeds %d bytes (%d)".formatted(settings.getMaxExtractionSize(), size));
    }

    private static Charset charsetOf(String contentType) {
        int idx = contentType.indexOf("charset=");
        if (idx >= 0) {
            String name = contentType.substring(idx + 8).split("[;\\s]")[0].replace("\"", "");
            try {
                return Charset.forName(name);
            } catch (RuntimeException e) {
                log.debug("Unknown charset '{}', using UTF-8", name);
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

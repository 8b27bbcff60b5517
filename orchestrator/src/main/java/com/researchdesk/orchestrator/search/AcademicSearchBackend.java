package com.researchdesk.orchestrator.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Academic paper search through the Semantic Scholar Graph API.
 *
 * The public API answers 429 quickly under load, so requests from all jobs
 * are spaced by a minimum interval before they go out. 429s that still
 * happen surface as RATE_LIMITED and are retried by the registry's policy.
 */
@Component
public class AcademicSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(AcademicSearchBackend.class);

    private static final String FIELDS = "title,authors,year,venue,url,abstract";

    private final HttpClient http;
    private final ResearchProperties.Academic settings;
    private final SemanticScholarResponseParser parser;
    private final String userAgent;
    private final int    snippetLength;

    private final Object throttleLock = new Object();
    private long nextSlotNanos = System.nanoTime();

    public AcademicSearchBackend(ResearchProperties properties, ObjectMapper objectMapper) {
        this.settings      = properties.getSearch().getAcademic();
        this.userAgent     = properties.getSearch().getUserAgent();
        this.snippetLength = properties.getSearch().getSnippetLength();
        this.parser        = new SemanticScholarResponseParser(objectMapper);
        this.http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.ACADEMIC;
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public List<SourceHit> search(String query, int count) {
        log.info("Academic search for '{}' (count={})", query, count);
        String url = "%s?query=%s&limit=%d&fields=%s".formatted(
                settings.getBaseUrl(), URLEncoder.encode(query, StandardCharsets.UTF_8), count, FIELDS);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(settings.getTimeout())
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET();
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            builder.header("x-api-key", settings.getApiKey());
        }

        HttpResponse<String> response;
        try {
            awaitRequestSlot();
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SearchException(BackendKind.ACADEMIC, SearchException.Kind.UNREACHABLE,
                    "timed out after " + settings.getTimeout().toMillis() + " ms", e);
        } catch (IOException e) {
            throw new SearchException(BackendKind.ACADEMIC, SearchException.Kind.UNREACHABLE,
                    "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException(BackendKind.ACADEMIC, SearchException.Kind.UNREACHABLE,
                    "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw SearchException.forStatus(BackendKind.ACADEMIC, response.statusCode());
        }

        List<SourceHit> hits = parser.parse(response.body(), count, snippetLength);
        log.info("Academic search completed: {} results", hits.size());
        return hits;
    }

    /** Reserve the next free request slot and sleep until it arrives. */
    private void awaitRequestSlot() throws InterruptedException {
        long interval = settings.getMinRequestInterval().toNanos();
        if (interval <= 0) return;

        long waitNanos;
        synchronized (throttleLock) {
            long now  = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + interval;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            log.debug("Throttling academic request for {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }
}

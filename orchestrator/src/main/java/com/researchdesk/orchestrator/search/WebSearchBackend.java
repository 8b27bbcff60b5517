package com.researchdesk.orchestrator.search;

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

/**
 * General web search through the DuckDuckGo HTML endpoint.
 *
 * The HTML endpoint needs no API key; result markup is parsed by
 * {@link DuckDuckGoResultParser}.
 */
@Component
public class WebSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(WebSearchBackend.class);

    private final HttpClient http;
    private final ResearchProperties.Web settings;
    private final String userAgent;
    private final int    snippetLength;

    public WebSearchBackend(ResearchProperties properties) {
        this.settings      = properties.getSearch().getWeb();
        this.userAgent     = properties.getSearch().getUserAgent();
        this.snippetLength = properties.getSearch().getSnippetLength();
        this.http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.WEB;
    }

    @Override
    public boolean isEnabled() {
        return settings.isEnabled();
    }

    @Override
    public List<SourceHit> search(String query, int count) {
        log.info("Web search for '{}' (count={})", query, count);
        String url = settings.getBaseUrl() + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(settings.getTimeout())
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SearchException(BackendKind.WEB, SearchException.Kind.UNREACHABLE,
                    "timed out after " + settings.getTimeout().toMillis() + " ms", e);
        } catch (IOException e) {
            throw new SearchException(BackendKind.WEB, SearchException.Kind.UNREACHABLE,
                    "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException(BackendKind.WEB, SearchException.Kind.UNREACHABLE,
                    "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw SearchException.forStatus(BackendKind.WEB, response.statusCode());
        }

        List<SourceHit> hits = DuckDuckGoResultParser.parse(response.body(), count, snippetLength);
        log.info("Web search completed: {} results", hits.size());
        return hits;
    }
}

package com.researchdesk.orchestrator.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchdesk.orchestrator.config.ResearchProperties;
import com.researchdesk.orchestrator.model.SourceHit;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the academic backend against a local JDK HttpServer standing in for
 * the Semantic Scholar API.
 */
class AcademicSearchBackendTest {

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> body = new AtomicReference<>("{\"data\": []}");
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastApiKey = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/graph/v1/paper/search", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            lastApiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void search_sendsQueryFieldsAndApiKey() {
        body.set("""
                {"data": [{"title": "Deep Residual Learning", "url": "https://papers.example/resnet",
                           "year": 2016, "authors": [{"name": "K. He"}],
                           "abstract": "Deeper neural networks are more difficult to train."}]}
                """);
        AcademicSearchBackend backend = backend("secret-key");

        List<SourceHit> hits = backend.search("residual networks", 3);

        assertThat(hits).extracting(SourceHit::title).containsExactly("Deep Residual Learning");
        assertThat(lastQuery.get()).contains("query=residual+networks", "limit=3",
                "fields=title,authors,year,venue,url,abstract");
        assertThat(lastApiKey.get()).isEqualTo("secret-key");
    }

    @Test
    void search_withoutApiKey_sendsNoKeyHeader() {
        backend("").search("q", 1);

        assertThat(lastApiKey.get()).isNull();
    }

    @Test
    void http429_isRateLimited() {
        status.set(429);

        assertThatThrownBy(() -> backend("").search("q", 1))
                .isInstanceOfSatisfying(SearchException.class, e -> assertThat(e.isRateLimited()).isTrue());
    }

    @Test
    void http503_isUnreachable() {
        status.set(503);

        assertThatThrownBy(() -> backend("").search("q", 1))
                .isInstanceOfSatisfying(SearchException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SearchException.Kind.UNREACHABLE));
    }

    @Test
    void http400_isMalformed() {
        status.set(400);

        assertThatThrownBy(() -> backend("").search("q", 1))
                .isInstanceOfSatisfying(SearchException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SearchException.Kind.MALFORMED));
    }

    private AcademicSearchBackend backend(String apiKey) {
        ResearchProperties properties = new ResearchProperties();
        ResearchProperties.Academic academic = properties.getSearch().getAcademic();
        academic.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/graph/v1/paper/search");
        academic.setApiKey(apiKey);
        academic.setMinRequestInterval(Duration.ZERO);
        academic.setTimeout(Duration.ofSeconds(5));
        return new AcademicSearchBackend(properties, new ObjectMapper());
    }
}

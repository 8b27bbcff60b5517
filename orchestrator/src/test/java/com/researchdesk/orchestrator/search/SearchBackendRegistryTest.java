package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import com.researchdesk.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchBackendRegistryTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    private static final RetryPolicy THREE_ATTEMPTS =
            new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(1), 0.0, d -> {}, () -> 0.5);

    @Test
    void search_retriesRateLimitAndRecordsEveryAttempt() {
        AtomicInteger calls = new AtomicInteger();
        SearchBackend flaky = backend(BackendKind.ACADEMIC, (query, count) -> {
            if (calls.incrementAndGet() == 1) throw SearchException.forStatus(BackendKind.ACADEMIC, 429);
            return List.of(new SourceHit("Paper", "https://papers.example/1", "s", BackendKind.ACADEMIC));
        });
        SearchBackendRegistry registry = registry(flaky);

        List<SourceHit> hits = registry.search(BackendKind.ACADEMIC, "protein folding", 3);

        assertThat(hits).hasSize(1);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(meters.counter("research.search.calls", "backend", "academic", "status", "rate_limited").count())
                .isEqualTo(1.0);
        assertThat(meters.counter("research.search.calls", "backend", "academic", "status", "success").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("research.search.duration", "backend", "academic").count()).isEqualTo(2);
    }

    @Test
    void search_unreachableIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        SearchBackendRegistry registry = registry(backend(BackendKind.WEB, (query, count) -> {
            calls.incrementAndGet();
            throw new SearchException(BackendKind.WEB, SearchException.Kind.UNREACHABLE, "connection refused");
        }));

        assertThatThrownBy(() -> registry.search(BackendKind.WEB, "q", 3))
                .isInstanceOfSatisfying(SearchException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SearchException.Kind.UNREACHABLE));
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void search_unexpectedExceptionBecomesMalformed() {
        SearchBackendRegistry registry = registry(backend(BackendKind.WEB, (query, count) -> {
            throw new NullPointerException("title");
        }));

        assertThatThrownBy(() -> registry.search(BackendKind.WEB, "q", 3))
                .isInstanceOfSatisfying(SearchException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(SearchException.Kind.MALFORMED);
                    assertThat(e.getBackend()).isEqualTo(BackendKind.WEB);
                });
        assertThat(meters.counter("research.search.calls", "backend", "web", "status", "error").count())
                .isEqualTo(1.0);
    }

    @Test
    void missingOrDisabledBackend_isUnavailable() {
        SearchBackend disabled = new FakeBackend(BackendKind.WEB, false, (q, c) -> List.of());
        SearchBackendRegistry registry = registry(disabled);

        assertThat(registry.isAvailable(BackendKind.WEB)).isFalse();
        assertThat(registry.isAvailable(BackendKind.ACADEMIC)).isFalse();
        assertThatThrownBy(() -> registry.search(BackendKind.ACADEMIC, "q", 1))
                .isInstanceOf(SearchException.class)
                .hasMessageContaining("not available");
    }

    @Test
    void duplicateBackendKinds_areRejected() {
        SearchBackend a = backend(BackendKind.WEB, (q, c) -> List.of());
        SearchBackend b = backend(BackendKind.WEB, (q, c) -> List.of());

        assertThatThrownBy(() -> new SearchBackendRegistry(List.of(a, b), Map.of(), meters))
                .isInstanceOf(IllegalStateException.class);
    }

    private SearchBackendRegistry registry(SearchBackend... backends) {
        return new SearchBackendRegistry(List.of(backends),
                Map.of(BackendKind.WEB, THREE_ATTEMPTS, BackendKind.ACADEMIC, THREE_ATTEMPTS), meters);
    }

    private static SearchBackend backend(BackendKind kind, Search search) {
        return new FakeBackend(kind, true, search);
    }

    @FunctionalInterface
    interface Search {
        List<SourceHit> run(String query, int count);
    }

    private record FakeBackend(BackendKind kind, boolean isEnabled, Search search) implements SearchBackend {
        @Override
        public List<SourceHit> search(String query, int count) {
            return search.run(query, count);
        }
    }
}

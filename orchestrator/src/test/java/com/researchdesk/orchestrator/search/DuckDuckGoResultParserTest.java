package com.researchdesk.orchestrator.search;

import com.researchdesk.orchestrator.model.BackendKind;
import com.researchdesk.orchestrator.model.SourceHit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DuckDuckGoResultParserTest {

    private static final String PAGE = """
            <html><body>
              <div class="result">
                <h2 class="result__title">
                  <a href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fen.wikipedia.org%2Fwiki%2FPerovskite&amp;rut=abc">Perovskite - Wikipedia</a>
                </h2>
                <a class="result__snippet">Perovskite is a calcium titanium oxide mineral.</a>
              </div>
              <div class="result">
                <h2 class="result__title"><a href="https://www.nrel.gov/pv/perovskite.html">Perovskite Solar Cells</a></h2>
              </div>
              <div class="result">
                <div class="no-title">ad block without a link</div>
              </div>
              <div class="result">
                <h2 class="result__title"><a href="https://third.example/">Third</a></h2>
                <a class="result__snippet">Third snippet</a>
              </div>
            </body></html>
            """;

    @Test
    void parse_extractsTitleUnwrappedUrlAndSnippet() {
        List<SourceHit> hits = DuckDuckGoResultParser.parse(PAGE, 10, 200);

        assertThat(hits).hasSize(3);
        SourceHit first = hits.get(0);
        assertThat(first.title()).isEqualTo("Perovskite - Wikipedia");
        assertThat(first.url()).isEqualTo("https://en.wikipedia.org/wiki/Perovskite");
        assertThat(first.snippet()).isEqualTo("Perovskite is a calcium titanium oxide mineral.");
        assertThat(first.backendKind()).isEqualTo(BackendKind.WEB);

        assertThat(hits.get(1).snippet()).isEqualTo("No snippet available");
    }

    @Test
    void parse_stopsAtRequestedCount() {
        assertThat(DuckDuckGoResultParser.parse(PAGE, 1, 200)).hasSize(1);
    }

    @Test
    void parse_truncatesSnippetToConfiguredLength() {
        List<SourceHit> hits = DuckDuckGoResultParser.parse(PAGE, 1, 10);

        assertThat(hits.get(0).snippet()).isEqualTo("Perovskite");
    }

    @Test
    void parse_pageWithoutResults_returnsEmptyList() {
        assertThat(DuckDuckGoResultParser.parse("<html><body>No results.</body></html>", 5, 200)).isEmpty();
    }

    @Test
    void parse_brokenEscapeInOneRedirect_skipsOnlyThatResult() {
        String page = """
                <html><body>
                  <div class="result">
                    <h2 class="result__title"><a href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fbad.example%2F%zz&amp;rut=1">Broken</a></h2>
                  </div>
                  <div class="result">
                    <h2 class="result__title"><a href="//duckduckgo.com/l/?uddg=https%3A%2F%2Fgood.example%2Fpage&amp;rut=2">Good</a></h2>
                    <a class="result__snippet">Good snippet</a>
                  </div>
                </body></html>
                """;

        List<SourceHit> hits = DuckDuckGoResultParser.parse(page, 10, 200);

        assertThat(hits).extracting(SourceHit::url).containsExactly("https://good.example/page");
    }

    @Test
    void unwrapRedirect_handlesProtocolRelativeAndPlainLinks() {
        assertThat(DuckDuckGoResultParser.unwrapRedirect("//example.org/page")).isEqualTo("https://example.org/page");
        assertThat(DuckDuckGoResultParser.unwrapRedirect("https://example.org/a")).isEqualTo("https://example.org/a");
        assertThat(DuckDuckGoResultParser.unwrapRedirect(null)).isEmpty();
        assertThat(DuckDuckGoResultParser.unwrapRedirect("//duckduckgo.com/l/?uddg=%zz")).isEmpty();
    }
}

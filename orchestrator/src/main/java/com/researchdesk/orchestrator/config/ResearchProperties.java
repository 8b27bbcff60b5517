package com.researchdesk.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * All tuning knobs of the research orchestrator, bound from {@code research.*}.
 *
 * Defaults here are the production values; application.yml only overrides
 * what differs per environment (API keys, base URLs).
 */
@ConfigurationProperties(prefix = "research")
public class ResearchProperties {

    private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    private final Jobs     jobs     = new Jobs();
    private final Progress progress = new Progress();
    private final Search   search   = new Search();
    private final Content  content  = new Content();
    private final Report   report   = new Report();

    public Jobs     getJobs()     { return jobs; }
    public Progress getProgress() { return progress; }
    public Search   getSearch()   { return search; }
    public Content  getContent()  { return content; }
    public Report   getReport()   { return report; }

    // ------------------------------------------------------------------
    // research.jobs.*
    // ------------------------------------------------------------------

    public static class Jobs {
        /** Pipelines allowed to run at once; later submissions wait queued. */
        private int maxConcurrent = 4;
        private int minResults = 1;
        private int maxResults = 5;
        private int defaultResults = 2;
        private String defaultSources = "both";
        /** Concurrent content extractions per job. */
        private int extractionFanOut = 3;

        public int getMaxConcurrent()                { return maxConcurrent; }
        public void setMaxConcurrent(int v)          { this.maxConcurrent = v; }
        public int getMinResults()                   { return minResults; }
        public void setMinResults(int v)             { this.minResults = v; }
        public int getMaxResults()                   { return maxResults; }
        public void setMaxResults(int v)             { this.maxResults = v; }
        public int getDefaultResults()               { return defaultResults; }
        public void setDefaultResults(int v)         { this.defaultResults = v; }
        public String getDefaultSources()            { return defaultSources; }
        public void setDefaultSources(String v)      { this.defaultSources = v; }
        public int getExtractionFanOut()             { return extractionFanOut; }
        public void setExtractionFanOut(int v)       { this.extractionFanOut = v; }
    }

    // ------------------------------------------------------------------
    // research.progress.*
    // ------------------------------------------------------------------

    public static class Progress {
        private int started = 5;
        /** Reached when search and extraction are done; research progress stays below it. */
        private int researchComplete = 60;

        public int getStarted()                      { return started; }
        public void setStarted(int v)                { this.started = v; }
        public int getResearchComplete()             { return researchComplete; }
        public void setResearchComplete(int v)       { this.researchComplete = v; }
    }

    // ------------------------------------------------------------------
    // research.search.*
    // ------------------------------------------------------------------

    public static class Search {
        private int maxResults = 10;
        /** Hits requested per wanted source, so spares can replace failed extractions. */
        private int searchMultiplier = 3;
        private int snippetLength = 200;
        private String userAgent = DEFAULT_USER_AGENT;
        private final Web web = new Web();
        private final Academic academic = new Academic();

        public int getMaxResults()                   { return maxResults; }
        public void setMaxResults(int v)             { this.maxResults = v; }
        public int getSearchMultiplier()             { return searchMultiplier; }
        public void setSearchMultiplier(int v)       { this.searchMultiplier = v; }
        public int getSnippetLength()                { return snippetLength; }
        public void setSnippetLength(int v)          { this.snippetLength = v; }
        public String getUserAgent()                 { return userAgent; }
        public void setUserAgent(String v)           { this.userAgent = v; }
        public Web getWeb()                          { return web; }
        public Academic getAcademic()                { return academic; }
    }

    public static class Web {
        private boolean enabled = true;
        private String baseUrl = "https://html.duckduckgo.com/html/";
        private Duration timeout = Duration.ofSeconds(10);
        private final Retry retry = new Retry(2, Duration.ofSeconds(1), Duration.ofSeconds(8), 0.2);

        public boolean isEnabled()                   { return enabled; }
        public void setEnabled(boolean v)            { this.enabled = v; }
        public String getBaseUrl()                   { return baseUrl; }
        public void setBaseUrl(String v)             { this.baseUrl = v; }
        public Duration getTimeout()                 { return timeout; }
        public void setTimeout(Duration v)           { this.timeout = v; }
        public Retry getRetry()                      { return retry; }
    }

    public static class Academic {
        private boolean enabled = true;
        private String baseUrl = "https://api.semanticscholar.org/graph/v1/paper/search";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(5);
        /** Minimum spacing between two academic requests, process-wide. */
        private Duration minRequestInterval = Duration.ofSeconds(2);
        private final Retry retry = new Retry(4, Duration.ofSeconds(2), Duration.ofSeconds(16), 0.25);

        public boolean isEnabled()                   { return enabled; }
        public void setEnabled(boolean v)            { this.enabled = v; }
        public String getBaseUrl()                   { return baseUrl; }
        public void setBaseUrl(String v)             { this.baseUrl = v; }
        public String getApiKey()                    { return apiKey; }
        public void setApiKey(String v)              { this.apiKey = v; }
        public Duration getTimeout()                 { return timeout; }
        public void setTimeout(Duration v)           { this.timeout = v; }
        public Duration getMinRequestInterval()      { return minRequestInterval; }
        public void setMinRequestInterval(Duration v) { this.minRequestInterval = v; }
        public Retry getRetry()                      { return retry; }
    }

    public static class Retry {
        private int maxAttempts;
        private Duration baseDelay;
        private Duration maxDelay;
        private double jitterFraction;

        public Retry() {
            this(3, Duration.ofSeconds(1), Duration.ofSeconds(10), 0.2);
        }

        public Retry(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction) {
            this.maxAttempts    = maxAttempts;
            this.baseDelay      = baseDelay;
            this.maxDelay       = maxDelay;
            this.jitterFraction = jitterFraction;
        }

        public int getMaxAttempts()                  { return maxAttempts; }
        public void setMaxAttempts(int v)            { this.maxAttempts = v; }
        public Duration getBaseDelay()               { return baseDelay; }
        public void setBaseDelay(Duration v)         { this.baseDelay = v; }
        public Duration getMaxDelay()                { return maxDelay; }
        public void setMaxDelay(Duration v)          { this.maxDelay = v; }
        public double getJitterFraction()            { return jitterFraction; }
        public void setJitterFraction(double v)      { this.jitterFraction = v; }
    }

    // ------------------------------------------------------------------
    // research.content.*
    // ------------------------------------------------------------------

    public static class Content {
        private Duration timeout = Duration.ofSeconds(8);
        /** Hard ceiling in bytes; larger documents fail with TOO_LARGE. */
        private int maxExtractionSize = 2_000_000;
        /** Readable text kept per source; longer text is truncated. */
        private int maxContentLength = 2000;
        /** Cap on the assembled raw data of one job. */
        private int maxRawDataLength = 20_000;
        private int maxParagraphs = 5;
        private int maxElements = 8;
        private String userAgent = DEFAULT_USER_AGENT;

        public Duration getTimeout()                 { return timeout; }
        public void setTimeout(Duration v)           { this.timeout = v; }
        public int getMaxExtractionSize()            { return maxExtractionSize; }
        public void setMaxExtractionSize(int v)      { this.maxExtractionSize = v; }
        public int getMaxContentLength()             { return maxContentLength; }
        public void setMaxContentLength(int v)       { this.maxContentLength = v; }
        public int getMaxRawDataLength()             { return maxRawDataLength; }
        public void setMaxRawDataLength(int v)       { this.maxRawDataLength = v; }
        public int getMaxParagraphs()                { return maxParagraphs; }
        public void setMaxParagraphs(int v)          { this.maxParagraphs = v; }
        public int getMaxElements()                  { return maxElements; }
        public void setMaxElements(int v)            { this.maxElements = v; }
        public String getUserAgent()                 { return userAgent; }
        public void setUserAgent(String v)           { this.userAgent = v; }
    }

    // ------------------------------------------------------------------
    // research.report.*
    // ------------------------------------------------------------------

    public static class Report {
        private String defaultProvider = "openai";
        private Duration timeout = Duration.ofSeconds(120);
        private int maxTokens = 4000;
        private double temperature = 0.1;
        private final Provider openai =
                new Provider("https://api.openai.com/v1", "gpt-4");
        private final Provider anthropic =
                new Provider("https://api.anthropic.com/v1", "claude-3-5-sonnet-20240620");
        private final Provider groq =
                new Provider("https://api.groq.com/openai/v1", "llama-3.1-70b-versatile");

        public String getDefaultProvider()           { return defaultProvider; }
        public void setDefaultProvider(String v)     { this.defaultProvider = v; }
        public Duration getTimeout()                 { return timeout; }
        public void setTimeout(Duration v)           { this.timeout = v; }
        public int getMaxTokens()                    { return maxTokens; }
        public void setMaxTokens(int v)              { this.maxTokens = v; }
        public double getTemperature()               { return temperature; }
        public void setTemperature(double v)         { this.temperature = v; }
        public Provider getOpenai()                  { return openai; }
        public Provider getAnthropic()               { return anthropic; }
        public Provider getGroq()                    { return groq; }
    }

    public static class Provider {
        /** Empty means the provider is not configured and reports are skipped. */
        private String apiKey = "";
        private String baseUrl;
        private String defaultModel;

        public Provider() {}

        public Provider(String baseUrl, String defaultModel) {
            this.baseUrl      = baseUrl;
            this.defaultModel = defaultModel;
        }

        public String getApiKey()                    { return apiKey; }
        public void setApiKey(String v)              { this.apiKey = v; }
        public String getBaseUrl()                   { return baseUrl; }
        public void setBaseUrl(String v)             { this.baseUrl = v; }
        public String getDefaultModel()              { return defaultModel; }
        public void setDefaultModel(String v)        { this.defaultModel = v; }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}

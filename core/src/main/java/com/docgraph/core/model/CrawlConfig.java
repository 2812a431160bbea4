package com.docgraph.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 탐색 설정 (docgraph.yml 매핑 대상). 순수 설정 보관용.
 * 호출별 인자(baseUrl/depth/patterns)는 서비스 호출 시 덮어쓴다.
 */
public final class CrawlConfig {

    /** 페이지 fetch 구현 선택 */
    public enum FetcherType { JSOUP, CRAWL4AI }

    /** 패턴 미지정 시 기본 포함 패턴(기술 문서 경로) */
    public static final List<String> DEFAULT_PATTERNS =
            List.of("/api/", "/guide/", "/docs/", "/reference/", "/tutorial/");

    public static final int DEFAULT_PAGE_BOUND = 50;

    /** YAML `crawl4ai:` 섹션 */
    public static final class Crawl4AiCfg {
        private String baseUrl = "http://localhost:11235";
        /** structured 모드에서 LLM 추출을 요청할 provider. 비어 있으면 HTML 기반 추출로 대체 */
        private String llmProvider = "";
        private String apiToken = "";

        public String getBaseUrl() { return baseUrl; }
        public Crawl4AiCfg setBaseUrl(String v) { this.baseUrl = v; return this; }
        public String getLlmProvider() { return llmProvider; }
        public Crawl4AiCfg setLlmProvider(String v) { this.llmProvider = (v == null ? "" : v); return this; }
        public String getApiToken() { return apiToken; }
        public Crawl4AiCfg setApiToken(String v) { this.apiToken = (v == null ? "" : v); return this; }
    }

    /** YAML `store:` 섹션 */
    public static final class StoreCfg {
        private Path dir = Path.of("out", "graphs");
        private boolean enabled = true;

        public Path getDir() { return dir; }
        public StoreCfg setDir(Path dir) { this.dir = dir; return this; }
        public boolean isEnabled() { return enabled; }
        public StoreCfg setEnabled(boolean v) { this.enabled = v; return this; }
    }

    /** YAML `cache:` 섹션: fetch 결과 캐시(개수 상한 + 나이 기반 만료) */
    public static final class CacheCfg {
        private boolean enabled = true;
        private int maxEntries = 256;
        private int ttlMinutes = 30;

        public boolean isEnabled() { return enabled; }
        public CacheCfg setEnabled(boolean v) { this.enabled = v; return this; }
        public int getMaxEntries() { return maxEntries; }
        public CacheCfg setMaxEntries(int v) { this.maxEntries = v; return this; }
        public int getTtlMinutes() { return ttlMinutes; }
        public CacheCfg setTtlMinutes(int v) { this.ttlMinutes = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private int maxDepth = 2;
    private int pageBound = DEFAULT_PAGE_BOUND;
    private List<String> patterns = List.of();      // 비어 있으면 DEFAULT_PATTERNS
    private Duration timeout = Duration.ofSeconds(15);
    private int concurrency = 1;                    // 1 = 순차 BFS
    private int rps = 10;
    private boolean followRedirects = true;
    private String userAgent = "docgraph/0.1 (+crawler)";
    private int maxBodyBytes = 5 * 1024 * 1024;
    private FetcherType fetcher = FetcherType.JSOUP;

    private Crawl4AiCfg crawl4ai = new Crawl4AiCfg();
    private StoreCfg store = new StoreCfg();
    private CacheCfg cache = new CacheCfg();

    // ---------- getters ----------
    public int getMaxDepth() { return maxDepth; }
    public int getPageBound() { return pageBound; }
    public List<String> getPatterns() { return patterns; }
    public Duration getTimeout() { return timeout; }
    public int getConcurrency() { return concurrency; }
    public int getRps() { return rps; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public int getMaxBodyBytes() { return maxBodyBytes; }
    public FetcherType getFetcher() { return fetcher; }
    public Crawl4AiCfg getCrawl4ai() { return crawl4ai; }
    public StoreCfg getStore() { return store; }
    public CacheCfg getCache() { return cache; }

    /** 실제로 적용될 포함 패턴(비어 있으면 기본 패턴) */
    public List<String> effectivePatterns() {
        return (patterns == null || patterns.isEmpty()) ? DEFAULT_PATTERNS : patterns;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setPageBound(int pageBound) { this.pageBound = pageBound; return this; }
    public CrawlConfig setPatterns(List<String> patterns) {
        this.patterns = (patterns == null) ? List.of() : List.copyOf(patterns);
        return this;
    }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setRps(int rps) { this.rps = rps; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setMaxBodyBytes(int v) { this.maxBodyBytes = v; return this; }
    public CrawlConfig setFetcher(FetcherType fetcher) {
        this.fetcher = (fetcher != null ? fetcher : FetcherType.JSOUP);
        return this;
    }
    public CrawlConfig setCrawl4ai(Crawl4AiCfg c) { this.crawl4ai = (c != null ? c : new Crawl4AiCfg()); return this; }
    public CrawlConfig setStore(StoreCfg s) { this.store = (s != null ? s : new StoreCfg()); return this; }
    public CrawlConfig setCache(CacheCfg c) { this.cache = (c != null ? c : new CacheCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (pageBound < 0) throw new IllegalArgumentException("pageBound must be >= 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        if (maxBodyBytes < 0) throw new IllegalArgumentException("maxBodyBytes must be >= 0");
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(fetcher, "fetcher");

        Objects.requireNonNull(crawl4ai, "crawl4ai");
        if (fetcher == FetcherType.CRAWL4AI && (crawl4ai.getBaseUrl() == null || crawl4ai.getBaseUrl().isBlank()))
            throw new IllegalArgumentException("crawl4ai.baseUrl is required when fetcher=CRAWL4AI");

        Objects.requireNonNull(store, "store");
        if (store.isEnabled()) Objects.requireNonNull(store.getDir(), "store.dir");

        Objects.requireNonNull(cache, "cache");
        if (cache.getMaxEntries() < 1) throw new IllegalArgumentException("cache.maxEntries must be >= 1");
        if (cache.getTtlMinutes() < 0) throw new IllegalArgumentException("cache.ttlMinutes must be >= 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    /** jsoup 등 int ms 필요 시 편의 메서드 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** 호출별 덮어쓰기용 얕은 복사(하위 섹션 객체는 공유) */
    public CrawlConfig copy() {
        return new CrawlConfig()
                .setMaxDepth(maxDepth)
                .setPageBound(pageBound)
                .setPatterns(patterns)
                .setTimeout(timeout)
                .setConcurrency(concurrency)
                .setRps(rps)
                .setFollowRedirects(followRedirects)
                .setUserAgent(userAgent)
                .setMaxBodyBytes(maxBodyBytes)
                .setFetcher(fetcher)
                .setCrawl4ai(crawl4ai)
                .setStore(store)
                .setCache(cache);
    }
}

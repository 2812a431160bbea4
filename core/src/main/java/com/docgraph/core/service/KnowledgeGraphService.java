package com.docgraph.core.service;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.api.IGraphStore;
import com.docgraph.core.api.IKnowledgeGraphTools;
import com.docgraph.core.crawler.ExtractorDispatcher;
import com.docgraph.core.crawler.TraversalEngine;
import com.docgraph.core.crawler.TraversalOutcome;
import com.docgraph.core.fetch.Crawl4AiFetchClient;
import com.docgraph.core.fetch.JsoupFetchClient;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.DocumentResponse;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.GraphCatalog;
import com.docgraph.core.model.GraphResponse;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.OperationError;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.store.CachingFetchClient;
import com.docgraph.core.store.FileGraphStore;
import com.docgraph.core.store.GraphStoreException;
import com.docgraph.core.store.InMemoryGraphStore;
import com.docgraph.core.store.PageCache;
import com.docgraph.core.util.ProgressListener;
import com.docgraph.core.util.StructuredLog;
import com.docgraph.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호출 계층이 쓰는 도구 모음의 기본 구현:
 *  - crawlDocumentation : 단일 페이지, 탐색 없음
 *  - extendKnowledgeGraph : 검증 → BFS 탐색 → 저장
 *  - getKnowledgeGraph / catalog : 저장소 조회
 *
 * 예외를 밖으로 던지지 않는다. 작업 전체 실패는 OperationError(stage=...)로,
 * 페이지 단위 실패는 pageFailures로 구분해서 돌려준다.
 * 호출마다 설정 사본을 만들어 쓰므로 동시에 여러 호출이 들어와도 서로 간섭하지 않는다.
 */
public final class KnowledgeGraphService implements IKnowledgeGraphTools, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeGraphService.class);
    private static final StructuredLog SLOG = StructuredLog.get(KnowledgeGraphService.class);

    public static final int DEFAULT_DEPTH = 2;
    static final List<String> PROMPT_PATTERNS = List.of("/api/", "/guide/", "/tutorial/");

    private final CrawlConfig config;
    private final IFetchClient client;
    private final ExtractorDispatcher dispatcher;
    private final IGraphStore store;

    /** 설정대로 fetch client / 캐시 / 저장소를 구성 */
    public static KnowledgeGraphService create(CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return new KnowledgeGraphService(config, fetchClientFor(config), storeFor(config));
    }

    /** DI/테스트용 */
    public KnowledgeGraphService(CrawlConfig config, IFetchClient client, IGraphStore store) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.client = Objects.requireNonNull(client, "client");
        this.dispatcher = new ExtractorDispatcher(client);
        this.store = Objects.requireNonNull(store, "store");
    }

    static IFetchClient fetchClientFor(CrawlConfig cfg) {
        IFetchClient base = switch (cfg.getFetcher()) {
            case JSOUP -> new JsoupFetchClient(cfg);
            case CRAWL4AI -> new Crawl4AiFetchClient(cfg);
        };
        if (!cfg.getCache().isEnabled()) return base;
        PageCache cache = new PageCache(cfg.getCache().getMaxEntries(),
                Duration.ofMinutes(cfg.getCache().getTtlMinutes()));
        return new CachingFetchClient(base, cache);
    }

    static IGraphStore storeFor(CrawlConfig cfg) {
        return cfg.getStore().isEnabled()
                ? new FileGraphStore(cfg.getStore().getDir())
                : new InMemoryGraphStore();
    }

    public CrawlConfig config() { return config; }
    public IGraphStore store() { return store; }

    /* =========================
       crawl_documentation
       ========================= */

    @Override
    public DocumentResponse crawlDocumentation(String url, String extractType) {
        if (UrlUtils.parseAbsolute(url) == null) {
            return DocumentResponse.failed(url, OperationError.STAGE_VALIDATE,
                    "url must be an absolute http(s) URL");
        }
        ExtractMode mode = ExtractMode.fromWireName(extractType);
        PageResult r = dispatcher.fetch(url.trim(), mode);
        if (!r.isSucceeded()) {
            LOG.warn("crawlDocumentation failed: {} -> {}", url, r.getError().orElse(""));
        }
        return DocumentResponse.from(r);
    }

    /* =========================
       extend_knowledge_graph
       ========================= */

    @Override
    public GraphResponse extendKnowledgeGraph(String framework, String baseUrl, int depth, List<String> patterns) {
        return extendKnowledgeGraph(framework, baseUrl, depth, patterns, ProgressListener.NONE, null);
    }

    /**
     * @param cancelFlag true가 되면 탐색을 멈추고 그때까지의 부분 그래프를 cancelled=true로 돌려준다.
     *                   취소된 그래프는 저장하지 않는다(이전 완전한 그래프를 덮어쓰지 않도록).
     */
    public GraphResponse extendKnowledgeGraph(String framework, String baseUrl, int depth, List<String> patterns,
                                              ProgressListener listener, AtomicBoolean cancelFlag) {
        String problem = validate(framework, baseUrl, depth);
        if (problem != null) {
            LOG.warn("extendKnowledgeGraph rejected: {}", problem);
            return GraphResponse.failed(KnowledgeGraph.empty(framework, baseUrl), List.of(),
                    new OperationError(OperationError.STAGE_VALIDATE, baseUrl, problem));
        }

        CrawlConfig callCfg = config.copy()
                .setMaxDepth(depth)
                .setPatterns(patterns);

        TraversalOutcome out;
        try {
            out = new TraversalEngine(callCfg, dispatcher).run(framework, baseUrl.trim(), listener, cancelFlag);
        } catch (RuntimeException e) {
            SLOG.error("traverse-failed", e, "framework", framework, "baseUrl", baseUrl);
            LOG.error("Traversal failed for {} ({})", framework, baseUrl, e);
            return GraphResponse.failed(KnowledgeGraph.empty(framework, baseUrl), List.of(),
                    OperationError.of(OperationError.STAGE_TRAVERSE, baseUrl, e));
        }

        if (out.cancelled()) {
            LOG.info("Traversal cancelled for {}: partial graph with {} nodes not persisted",
                    framework, out.graph().nodeCount());
            return GraphResponse.ok(out.graph(), out.failures(), true, false);
        }

        ProgressListener pl = (listener != null ? listener : ProgressListener.NONE);
        pl.onProgress(0.0, "store", 0, 1);
        try {
            store.save(out.graph());
        } catch (GraphStoreException e) {
            SLOG.error("store-failed", e, "framework", framework, "nodes", out.graph().nodeCount());
            LOG.error("Storing graph for {} failed: {}", framework, e.getMessage());
            return GraphResponse.failed(out.graph(), out.failures(),
                    OperationError.of(OperationError.STAGE_STORE, baseUrl, e));
        }
        pl.onProgress(1.0, "store", 1, 1);
        return GraphResponse.ok(out.graph(), out.failures(), false, true);
    }

    /** 검증 실패 사유(없으면 null) */
    static String validate(String framework, String baseUrl, int depth) {
        if (framework == null || framework.isBlank()) return "framework name must not be blank";
        if (UrlUtils.parseAbsolute(baseUrl) == null) return "baseUrl must be an absolute http(s) URL";
        if (depth < 0) return "depth must be >= 0";
        return null;
    }

    /* =========================
       get_knowledge_graph / catalog
       ========================= */

    @Override
    public GraphResponse getKnowledgeGraph() {
        try {
            KnowledgeGraph g = store.latest().orElseGet(() -> KnowledgeGraph.empty("", ""));
            return GraphResponse.ok(g, List.of(), false, !g.isEmpty());
        } catch (GraphStoreException e) {
            LOG.error("Loading latest graph failed: {}", e.getMessage());
            return GraphResponse.failed(KnowledgeGraph.empty("", ""), List.of(),
                    OperationError.of(OperationError.STAGE_STORE, null, e));
        }
    }

    @Override
    public GraphResponse getKnowledgeGraph(String framework) {
        if (framework == null || framework.isBlank()) {
            return GraphResponse.failed(KnowledgeGraph.empty("", ""), List.of(),
                    new OperationError(OperationError.STAGE_VALIDATE, null, "framework name must not be blank"));
        }
        try {
            Optional<KnowledgeGraph> g = store.load(framework);
            return GraphResponse.ok(g.orElseGet(() -> KnowledgeGraph.empty(framework, "")), List.of(),
                    false, g.isPresent());
        } catch (GraphStoreException e) {
            LOG.error("Loading graph for {} failed: {}", framework, e.getMessage());
            return GraphResponse.failed(KnowledgeGraph.empty(framework, ""), List.of(),
                    OperationError.of(OperationError.STAGE_STORE, null, e));
        }
    }

    /**
     * 저장소 요약. 조회 실패 시 빈 요약을 돌려주고 경고를 남긴다.
     */
    @Override
    public GraphCatalog catalog() {
        try {
            List<String> names = store.frameworks();
            int total = 0;
            Instant last = null;
            for (String n : names) {
                Optional<KnowledgeGraph> g = store.load(n);
                if (g.isEmpty()) continue;
                total += g.get().nodeCount();
                Instant c = g.get().createdAt();
                if (last == null || c.isAfter(last)) last = c;
            }
            return new GraphCatalog(names, total, last);
        } catch (GraphStoreException e) {
            LOG.warn("Catalog unavailable: {}", e.getMessage());
            return GraphCatalog.empty();
        }
    }

    /* =========================
       analyze_framework 프롬프트
       ========================= */

    public String analyzeFrameworkPrompt(String framework, String docsUrl) {
        String patterns = String.join("\", \"", PROMPT_PATTERNS);
        return "Please analyze the " + framework + " framework by:\n"
                + "\n"
                + "1. First, use the extend_knowledge_graph tool with these parameters:\n"
                + "   - framework_name: \"" + framework + "\"\n"
                + "   - base_url: \"" + docsUrl + "\"\n"
                + "   - depth: " + DEFAULT_DEPTH + "\n"
                + "   - patterns: [\"" + patterns + "\"]\n"
                + "\n"
                + "2. Then, summarize:\n"
                + "   - Core concepts and architecture\n"
                + "   - Main APIs and their purposes\n"
                + "   - Common use patterns\n"
                + "   - Integration points with other tools\n"
                + "\n"
                + "3. Finally, suggest how this framework could be useful in our current project context.\n";
    }

    @Override
    public void close() throws Exception {
        client.close();
    }
}

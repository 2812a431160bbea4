package com.docgraph.core.service;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.api.IGraphStore;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.DocumentResponse;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.GraphCatalog;
import com.docgraph.core.model.GraphResponse;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.OperationError;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.model.StructuredContent;
import com.docgraph.core.store.GraphStoreException;
import com.docgraph.core.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeGraphServiceTest {

    static final String ROOT = "https://ex.com/docs/";
    static final String A = "https://ex.com/docs/api/a";
    static final String B = "https://ex.com/docs/api/b";

    /** 세 페이지짜리 가짜 문서 사이트. 받은 요청 모드를 기록한다. */
    static class TinyDocs implements IFetchClient {
        final Map<String, List<String>> links = Map.of(
                ROOT, List.of(A, B, "https://other.com/x"),
                A, List.of(B),
                B, List.of());
        final List<PageRequest> requests = Collections.synchronizedList(new ArrayList<>());
        boolean closed;

        @Override public PageResult fetch(PageRequest req) {
            requests.add(req);
            if (!links.containsKey(req.url())) return PageResult.failure(req.url(), req.mode(), "HTTP 404");
            return PageResult.builder()
                    .url(req.url())
                    .mode(req.mode())
                    .title("Page " + req.url())
                    .text("# Page\n\nbody")
                    .structured(StructuredContent.builder().concept("Sessions").api("get(url)", "fetch").build())
                    .outboundLinks(links.get(req.url()))
                    .build();
        }

        @Override public void close() { closed = true; }
    }

    /** save가 항상 실패하는 저장소 */
    static final class BrokenStore implements IGraphStore {
        @Override public void save(KnowledgeGraph graph) throws GraphStoreException {
            throw new GraphStoreException("disk full");
        }
        @Override public Optional<KnowledgeGraph> load(String framework) throws GraphStoreException {
            throw new GraphStoreException("unreadable");
        }
        @Override public Optional<KnowledgeGraph> latest() throws GraphStoreException {
            throw new GraphStoreException("unreadable");
        }
        @Override public List<String> frameworks() throws GraphStoreException {
            throw new GraphStoreException("unreadable");
        }
    }

    CrawlConfig cfg;
    TinyDocs site;
    InMemoryGraphStore store;
    KnowledgeGraphService svc;

    @BeforeEach
    void setUp() {
        cfg = CrawlConfig.defaults().setRps(1000);
        site = new TinyDocs();
        store = new InMemoryGraphStore();
        svc = new KnowledgeGraphService(cfg, site, store);
    }

    // ---------- crawl_documentation ----------

    @Test
    void crawl_markdown_returnsText() {
        DocumentResponse r = svc.crawlDocumentation(ROOT, "markdown");
        assertThat(r.success()).isTrue();
        assertThat(r.content()).isEqualTo("# Page\n\nbody");
        assertThat(r.title()).isEqualTo("Page " + ROOT);
        assertThat(r.error()).isNull();
    }

    @Test
    void crawl_structured_returnsContent() {
        DocumentResponse r = svc.crawlDocumentation(ROOT, "structured");
        assertThat(r.content()).isInstanceOf(StructuredContent.class);
        StructuredContent sc = (StructuredContent) r.content();
        assertThat(sc.concepts()).containsExactly("Sessions");
        assertThat(sc.title()).isEqualTo("Page " + ROOT);
    }

    @Test
    void crawl_links_returnsOutboundLinksOnly() {
        DocumentResponse r = svc.crawlDocumentation(ROOT, "links");
        assertThat(r.content()).isNull();
        assertThat(r.links()).containsExactly(A, B, "https://other.com/x");
    }

    @Test
    void crawl_unknownType_fallsBackToMarkdown() {
        DocumentResponse r = svc.crawlDocumentation(ROOT, "pdf");
        assertThat(r.success()).isTrue();
        assertThat(site.requests).extracting(PageRequest::mode).containsExactly(ExtractMode.DOCUMENT);
    }

    @Test
    void crawl_invalidUrl_rejectedWithoutFetch() {
        DocumentResponse r = svc.crawlDocumentation("ftp://ex.com/file", "markdown");
        assertThat(r.success()).isFalse();
        assertThat(r.error().stage()).isEqualTo(OperationError.STAGE_VALIDATE);
        assertThat(site.requests).isEmpty();
    }

    @Test
    void crawl_fetchFailure_reportedAsFetchStage() {
        DocumentResponse r = svc.crawlDocumentation("https://ex.com/missing", "markdown");
        assertThat(r.success()).isFalse();
        assertThat(r.error().stage()).isEqualTo(OperationError.STAGE_FETCH);
        assertThat(r.error().message()).isEqualTo("HTTP 404");
    }

    // ---------- extend_knowledge_graph ----------

    @Test
    void extend_buildsAndPersistsGraph() {
        GraphResponse r = svc.extendKnowledgeGraph("Lib", ROOT, 1, null);

        assertThat(r.success()).isTrue();
        assertThat(r.persisted()).isTrue();
        assertThat(r.cancelled()).isFalse();
        assertThat(r.graph().nodes()).containsOnlyKeys(ROOT, A, B);
        assertThat(r.graph().node(A).orElseThrow().depth()).isEqualTo(1);
        assertThat(r.graph().relationships()).hasSize(2);
        assertThat(site.requests).extracting(PageRequest::mode).containsOnly(ExtractMode.STRUCTURED);

        GraphResponse stored = svc.getKnowledgeGraph("Lib");
        assertThat(stored.persisted()).isTrue();
        assertThat(stored.graph()).isEqualTo(r.graph());
        assertThat(svc.getKnowledgeGraph().graph().framework()).isEqualTo("Lib");
    }

    @Test
    void extend_depthZero_rootOnly_configUntouched() {
        GraphResponse r = svc.extendKnowledgeGraph("Lib", ROOT, 0, List.of("/api/"));
        assertThat(r.graph().nodes()).containsOnlyKeys(ROOT);
        assertThat(r.graph().relationships()).isEmpty();
        assertThat(svc.config().getMaxDepth()).isEqualTo(2);
        assertThat(svc.config().getPatterns()).isEmpty();
    }

    @Test
    void extend_invalidArguments_rejected() {
        GraphResponse blank = svc.extendKnowledgeGraph(" ", ROOT, 1, null);
        GraphResponse badUrl = svc.extendKnowledgeGraph("Lib", "docs/", 1, null);
        GraphResponse negative = svc.extendKnowledgeGraph("Lib", ROOT, -1, null);

        assertThat(List.of(blank, badUrl, negative)).allSatisfy(r -> {
            assertThat(r.success()).isFalse();
            assertThat(r.error().stage()).isEqualTo(OperationError.STAGE_VALIDATE);
            assertThat(r.graph().isEmpty()).isTrue();
        });
        assertThat(negative.error().message()).isEqualTo("depth must be >= 0");
        assertThat(site.requests).isEmpty();
    }

    @Test
    void extend_storeFailure_keepsGraphInResponse() {
        KnowledgeGraphService broken = new KnowledgeGraphService(cfg, site, new BrokenStore());
        GraphResponse r = broken.extendKnowledgeGraph("Lib", ROOT, 1, null);

        assertThat(r.success()).isFalse();
        assertThat(r.persisted()).isFalse();
        assertThat(r.error().stage()).isEqualTo(OperationError.STAGE_STORE);
        assertThat(r.error().message()).isEqualTo("disk full");
        assertThat(r.graph().nodeCount()).isEqualTo(3);
    }

    @Test
    void extend_cancelled_returnsPartialGraph_notPersisted() throws Exception {
        GraphResponse r = svc.extendKnowledgeGraph("Lib", ROOT, 2, null, null, new AtomicBoolean(true));

        assertThat(r.success()).isTrue();
        assertThat(r.cancelled()).isTrue();
        assertThat(r.persisted()).isFalse();
        assertThat(store.frameworks()).isEmpty();
    }

    @Test
    void extend_reportsStorePhase() {
        List<String> phases = Collections.synchronizedList(new ArrayList<>());
        svc.extendKnowledgeGraph("Lib", ROOT, 1, null, (p, phase, d, t) -> phases.add(phase), null);
        assertThat(phases).contains("crawl");
        assertThat(phases.get(phases.size() - 1)).isEqualTo("store");
    }

    @Test
    void extend_pageFailures_doNotFailOperation() {
        site = new TinyDocs() {
            @Override public PageResult fetch(PageRequest req) {
                if (req.url().equals(B)) return PageResult.failure(B, req.mode(), "HTTP 500");
                return super.fetch(req);
            }
        };
        svc = new KnowledgeGraphService(cfg, site, store);

        GraphResponse r = svc.extendKnowledgeGraph("Lib", ROOT, 1, null);
        assertThat(r.success()).isTrue();
        assertThat(r.graph().nodes()).containsOnlyKeys(ROOT, A);
        assertThat(r.pageFailures()).singleElement().satisfies(f -> {
            assertThat(f.url()).isEqualTo(B);
            assertThat(f.error()).isEqualTo("HTTP 500");
        });
    }

    // ---------- get_knowledge_graph / catalog ----------

    @Test
    void get_withNothingStored_returnsEmptyGraph() {
        GraphResponse latest = svc.getKnowledgeGraph();
        GraphResponse named = svc.getKnowledgeGraph("nope");

        assertThat(latest.success()).isTrue();
        assertThat(latest.persisted()).isFalse();
        assertThat(latest.graph().isEmpty()).isTrue();
        assertThat(named.success()).isTrue();
        assertThat(named.graph().framework()).isEqualTo("nope");
        assertThat(named.persisted()).isFalse();
    }

    @Test
    void get_blankFramework_rejected() {
        GraphResponse r = svc.getKnowledgeGraph("");
        assertThat(r.success()).isFalse();
        assertThat(r.error().stage()).isEqualTo(OperationError.STAGE_VALIDATE);
    }

    @Test
    void get_storeUnreadable_reportedAsStoreStage() {
        KnowledgeGraphService broken = new KnowledgeGraphService(cfg, site, new BrokenStore());
        assertThat(broken.getKnowledgeGraph().error().stage()).isEqualTo(OperationError.STAGE_STORE);
        assertThat(broken.getKnowledgeGraph("Lib").error().stage()).isEqualTo(OperationError.STAGE_STORE);
    }

    @Test
    void catalog_summarizesStore() {
        svc.extendKnowledgeGraph("Lib", ROOT, 1, null);
        svc.extendKnowledgeGraph("Lib-core", ROOT, 0, null);

        GraphCatalog c = svc.catalog();
        assertThat(c.frameworks()).containsExactly("Lib", "Lib-core");
        assertThat(c.totalNodes()).isEqualTo(4);
        assertThat(c.lastUpdated()).isEqualTo(store.load("Lib-core").orElseThrow().createdAt());
    }

    @Test
    void catalog_storeUnreadable_isEmpty() {
        KnowledgeGraphService broken = new KnowledgeGraphService(cfg, site, new BrokenStore());
        assertThat(broken.catalog()).isEqualTo(GraphCatalog.empty());
    }

    // ---------- misc ----------

    @Test
    void prompt_namesToolAndArguments() {
        String p = svc.analyzeFrameworkPrompt("FastAPI", "https://fastapi.tiangolo.com/");
        assertThat(p)
                .startsWith("Please analyze the FastAPI framework by:")
                .contains("framework_name: \"FastAPI\"")
                .contains("base_url: \"https://fastapi.tiangolo.com/\"")
                .contains("depth: 2")
                .contains("patterns: [\"/api/\", \"/guide/\", \"/tutorial/\"]")
                .contains("3. Finally, suggest how this framework could be useful");
    }

    @Test
    void create_withStoreDisabled_usesMemoryStore() throws Exception {
        CrawlConfig c = CrawlConfig.defaults();
        c.getStore().setEnabled(false);
        try (KnowledgeGraphService s = KnowledgeGraphService.create(c)) {
            assertThat(s.store()).isInstanceOf(InMemoryGraphStore.class);
        }
    }

    @Test
    void close_closesFetchClient() throws Exception {
        svc.close();
        assertThat(site.closed).isTrue();
    }
}

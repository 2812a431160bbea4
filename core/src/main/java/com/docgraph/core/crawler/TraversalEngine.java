package com.docgraph.core.crawler;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.CrawlStats;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.FrontierEntry;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.PageFailure;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.util.ProgressListener;
import com.docgraph.core.util.RateLimiter;
import com.docgraph.core.util.StructuredLog;
import com.docgraph.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * BFS 탐색 루프: Frontier Scheduler → Extractor Dispatcher(STRUCTURED) → Link Filter
 * → Scheduler.offer(depth+1) → Graph Assembler.
 *
 * <p>동시성: concurrency=1이면 한 번에 fetch 하나(기준 동작).
 * concurrency>1이면 같은 depth 레벨의 항목을 최대 concurrency개씩 동시에 fetch하되,
 * 결과는 dequeue 순서대로 접는다 → 순차 실행과 같은 그래프.
 *
 * <p>각 fetch는 (timeout + 유예) 안에 끝나야 하며, 넘기면 fetch 실패와 똑같이 취급한다.
 * 취소는 frontier를 꺼내는 사이사이에 확인하고, 그때까지 기록된 노드/엣지는 유효한 부분 그래프로 반환한다.
 */
public final class TraversalEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TraversalEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(TraversalEngine.class);

    static final long MIN_GRACE_MS = 1_000;

    private final CrawlConfig config;
    private final ExtractorDispatcher dispatcher;

    public TraversalEngine(CrawlConfig config, IFetchClient client) {
        this(config, new ExtractorDispatcher(client));
    }

    public TraversalEngine(CrawlConfig config, ExtractorDispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public TraversalOutcome run(String framework, String baseUrl) {
        return run(framework, baseUrl, ProgressListener.NONE, null);
    }

    /**
     * @param cancelFlag true가 되면 다음 frontier pop 전에 멈춘다(옵션)
     * @throws IllegalArgumentException baseUrl이 http(s) 절대 URL이 아닐 때
     */
    public TraversalOutcome run(String framework, String baseUrl, ProgressListener listener, AtomicBoolean cancelFlag) {
        Objects.requireNonNull(framework, "framework");
        final String root = UrlUtils.normalize(baseUrl);
        if (root == null) throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);

        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final int depthLimit = config.getMaxDepth();
        final int bound = config.getPageBound();
        final int cc = Math.max(1, config.getConcurrency());

        final FrontierScheduler scheduler = new FrontierScheduler();
        final LinkFilter filter = new LinkFilter(root, config.getPatterns());
        final GraphAssembler assembler = new GraphAssembler(framework, baseUrl);
        final CrawlStats stats = new CrawlStats();
        final List<PageFailure> failures = new ArrayList<>();

        scheduler.start(root, depthLimit, bound);

        LOG.info("Crawl start: framework={}, root={}, depth={}, bound={}, cc={}",
                framework, root, depthLimit, bound, cc);
        SLOG.info("crawl-start",
                "framework", framework,
                "root", root,
                "depth", depthLimit,
                "bound", bound,
                "cc", cc,
                "patterns", String.join(",", config.effectivePatterns()));
        pl.onProgress(0.0, "crawl", 0, bound);

        final RateLimiter limiter = RateLimiter.perSecond(config.getRps());
        final AtomicInteger inFlight = new AtomicInteger(0);
        final ExecutorService exec = newPool(cc);
        boolean cancelled = false;

        try {
            while (!scheduler.isExhausted()) {
                if (isCancelled(cancelFlag)) { cancelled = true; break; }

                List<FrontierEntry> batch = (cc == 1)
                        ? scheduler.next().map(List::of).orElse(List.of())
                        : scheduler.nextLevel(cc);
                if (batch.isEmpty()) break;

                List<Future<Fetched>> futures = new ArrayList<>(batch.size());
                for (FrontierEntry e : batch) {
                    stats.onDequeued();
                    futures.add(exec.submit(() -> fetchOne(e, limiter, inFlight, stats)));
                }

                // dequeue 순서대로 접기
                for (int i = 0; i < batch.size(); i++) {
                    FrontierEntry e = batch.get(i);
                    PageResult r;
                    try {
                        r = await(futures.get(i), e, stats);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        cancelled = true;
                        futures.forEach(f -> f.cancel(true));
                        break;
                    }
                    fold(e, r, depthLimit, scheduler, filter, assembler, stats, failures);

                    int done = scheduler.dequeuedCount();
                    double p = bound == 0 ? 1.0 : Math.min(1.0, (double) done / bound);
                    try {
                        pl.onProgress(p, "crawl", done, bound);
                    } catch (RuntimeException ex) {
                        LOG.debug("progress listener failed: {}", ex.toString());
                    }
                }
                if (cancelled) break;
            }
        } finally {
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(config.getTimeoutMs() + MIN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warn("fetch workers did not terminate in time (root={})", root);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        KnowledgeGraph graph = assembler.finalizeGraph();
        CrawlStats.Snapshot snap = stats.snapshot();
        int left = scheduler.pending();

        LOG.info("Crawl done: framework={}, nodes={}, edges={}, failed={}, frontierLeft={}, cancelled={}",
                framework, graph.nodeCount(), graph.edgeCount(), snap.failed, left, cancelled);
        SLOG.info("crawl-done",
                "framework", framework,
                "nodes", graph.nodeCount(),
                "edges", graph.edgeCount(),
                "dequeued", snap.dequeued,
                "failed", snap.failed,
                "timedOut", snap.timedOut,
                "rejected", snap.filterRejections,
                "frontierLeft", left,
                "maxObservedCC", snap.maxObservedConcurrency,
                "cancelled", cancelled);
        pl.onProgress(1.0, "crawl", scheduler.dequeuedCount(), bound);

        return new TraversalOutcome(graph, failures, snap, cancelled, left);
    }

    /* =========================
       내부 단계
       ========================= */

    /** 작업 스레드 결과. 통계는 접는 쪽(await)에서만 기록한다. */
    private record Fetched(PageResult result, long wallMs) {}

    private Fetched fetchOne(FrontierEntry e, RateLimiter limiter, AtomicInteger inFlight, CrawlStats stats) {
        try {
            limiter.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return new Fetched(PageResult.failure(e.url(), ExtractMode.STRUCTURED, "interrupted before fetch"), 0);
        }
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        long t0 = System.nanoTime();
        try {
            LOG.debug("fetch: {} (depth {})", e.url(), e.depth());
            PageResult r = dispatcher.fetch(e.url(), ExtractMode.STRUCTURED);
            return new Fetched(r, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * 마감 시간 안에 결과를 기다린다. 마감 초과/작업 예외는 실패 결과로 바꾼다.
     * 항목 하나당 통계는 여기서 정확히 한 번 기록된다(마감을 넘긴 작업이 나중에 끝나도 다시 세지 않음).
     */
    private PageResult await(Future<Fetched> f, FrontierEntry e, CrawlStats stats) throws InterruptedException {
        long deadlineMs = config.getTimeoutMs() + Math.max(MIN_GRACE_MS, config.getTimeoutMs() / 2);
        try {
            Fetched done = f.get(deadlineMs, TimeUnit.MILLISECONDS);
            if (done.result().isSucceeded()) stats.onFetched(done.wallMs());
            else stats.onFailed(done.wallMs(), false);
            return done.result();
        } catch (TimeoutException te) {
            f.cancel(true);
            stats.onFailed(deadlineMs, true);
            return PageResult.failure(e.url(), ExtractMode.STRUCTURED, "timeout after " + deadlineMs + "ms");
        } catch (CancellationException ce) {
            stats.onFailed(0, false);
            return PageResult.failure(e.url(), ExtractMode.STRUCTURED, "fetch cancelled");
        } catch (ExecutionException ee) {
            Throwable cause = (ee.getCause() != null ? ee.getCause() : ee);
            stats.onFailed(0, false);
            SLOG.error("fetch-task-failed", cause, "url", e.url());
            return PageResult.failure(e.url(), ExtractMode.STRUCTURED, ExtractorDispatcher.describe(cause));
        }
    }

    private static void fold(FrontierEntry e, PageResult r, int depthLimit,
                             FrontierScheduler scheduler, LinkFilter filter,
                             GraphAssembler assembler, CrawlStats stats, List<PageFailure> failures) {
        if (!r.isSucceeded()) {
            String err = r.getError().orElse("fetch failed");
            failures.add(new PageFailure(e.url(), e.depth(), "fetch", err));
            LOG.warn("Page failed: {} (depth {}) -> {}", e.url(), e.depth(), err);
            SLOG.warn("page-failed", "url", e.url(), "depth", e.depth(), "error", err);
            return;
        }

        assembler.recordNode(e.url(), e.depth(), r);

        int edges = 0;
        int enqueued = 0;
        if (e.depth() < depthLimit) {
            for (String link : r.getOutboundLinks()) {
                if (!filter.isEligible(link)) {
                    stats.onRejected();
                    continue;
                }
                assembler.recordEdge(e.url(), link);
                stats.onEdge();
                edges++;
                String n = UrlUtils.normalize(link);
                if (n != null && scheduler.offer(n, e.depth() + 1)) enqueued++;
            }
        }

        LOG.debug("Page recorded: {} (depth {}) edges={}, enqueued={}", e.url(), e.depth(), edges, enqueued);
        SLOG.debug("page-fetched",
                "url", e.url(),
                "depth", e.depth(),
                "links", r.getOutboundLinks().size(),
                "edges", edges,
                "enqueued", enqueued);
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    /** 고정 스레드풀(+역압) */
    private static ExecutorService newPool(int cc) {
        return new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("fetch-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
    }
}

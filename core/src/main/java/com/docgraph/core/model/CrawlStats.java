package com.docgraph.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 탐색 1회분 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicInteger dequeued  = new AtomicInteger(0);
    private final AtomicInteger fetchedOk = new AtomicInteger(0);
    private final AtomicInteger failed    = new AtomicInteger(0);
    private final AtomicInteger timedOut  = new AtomicInteger(0);   // failed에 포함
    private final AtomicInteger edges     = new AtomicInteger(0);
    private final AtomicLong rejected     = new AtomicLong(0);      // filter 탈락(고빈도)
    private final AtomicLong sumFetchMs   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void onDequeued() { dequeued.incrementAndGet(); }
    public void onFetched(long wallMs) { fetchedOk.incrementAndGet(); sumFetchMs.addAndGet(wallMs); }
    public void onFailed(long wallMs, boolean timeout) {
        failed.incrementAndGet();
        if (timeout) timedOut.incrementAndGet();
        sumFetchMs.addAndGet(wallMs);
    }
    public void onEdge() { edges.incrementAndGet(); }
    public void onRejected() { rejected.incrementAndGet(); }
    /** 현재 in-flight 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        int attempts = Math.max(1, fetchedOk.get() + failed.get());
        return new Snapshot(dequeued.get(), fetchedOk.get(), failed.get(), timedOut.get(),
                edges.get(), rejected.get(), maxObservedConcurrency.get(), sumFetchMs.get() / attempts);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int dequeued;
        public final int fetchedOk;
        public final int failed;
        public final int timedOut;
        public final int edges;
        public final long filterRejections;
        public final int maxObservedConcurrency;
        public final long avgFetchMs;

        public Snapshot(int dequeued, int fetchedOk, int failed, int timedOut, int edges,
                        long filterRejections, int maxObservedConcurrency, long avgFetchMs) {
            this.dequeued = dequeued;
            this.fetchedOk = fetchedOk;
            this.failed = failed;
            this.timedOut = timedOut;
            this.edges = edges;
            this.filterRejections = filterRejections;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgFetchMs = avgFetchMs;
        }
    }
}

package com.docgraph.core.crawler;

import com.docgraph.core.model.FrontierEntry;
import com.docgraph.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * BFS 큐 + 방문 집합.
 * - FIFO: depth가 루트로부터의 최단 발견 거리임을 보장
 * - offer 시점에 URL을 선점(claim) → 같은 URL이 두 번 큐에 들어가지 않음.
 *   선점은 {@link UrlUtils#visitKey} 기준이라 끝 슬래시만 다른 URL도 같은 페이지다
 * - pageBound는 dequeue 횟수 기준(실패한 fetch도 1회로 센다)
 * 모든 공개 메서드는 동기화되어 있어 check-and-mark가 원자적이다.
 */
public final class FrontierScheduler {

    private final Deque<FrontierEntry> frontier = new ArrayDeque<>();
    private final Set<String> claimed = new HashSet<>();
    private int requestedDepth;
    private int pageBound;
    private int dequeued;
    private boolean started;

    public synchronized void start(String rootUrl, int requestedDepth, int pageBound) {
        Objects.requireNonNull(rootUrl, "rootUrl");
        if (requestedDepth < 0) throw new IllegalArgumentException("requestedDepth must be >= 0");
        if (pageBound < 0) throw new IllegalArgumentException("pageBound must be >= 0");
        if (started) throw new IllegalStateException("scheduler already started");
        this.started = true;
        this.requestedDepth = requestedDepth;
        this.pageBound = pageBound;
        this.dequeued = 0;
        claimed.add(key(rootUrl));
        frontier.addLast(new FrontierEntry(rootUrl, 0));
    }

    /** 가장 오래된 항목. 큐가 비었거나 bound에 도달하면 empty. */
    public synchronized Optional<FrontierEntry> next() {
        ensureStarted();
        if (frontier.isEmpty() || dequeued >= pageBound) return Optional.empty();
        dequeued++;
        return Optional.of(frontier.pollFirst());
    }

    /**
     * 현재 맨 앞 항목과 같은 depth의 항목을 최대 max개까지 꺼낸다(레벨 단위 병렬 fetch용).
     * bound는 next()와 같은 규칙으로 적용.
     */
    public synchronized List<FrontierEntry> nextLevel(int max) {
        ensureStarted();
        List<FrontierEntry> out = new ArrayList<>();
        if (frontier.isEmpty()) return out;
        int depth = frontier.peekFirst().depth();
        while (out.size() < max && !frontier.isEmpty()
                && frontier.peekFirst().depth() == depth && dequeued < pageBound) {
            dequeued++;
            out.add(frontier.pollFirst());
        }
        return out;
    }

    /**
     * 이미 선점된 URL / depth 초과 / bound 도달이면 no-op(false).
     * 아니면 꼬리에 추가하고 선점.
     */
    public synchronized boolean offer(String url, int depth) {
        ensureStarted();
        if (url == null) return false;
        if (depth > requestedDepth || dequeued >= pageBound) return false;
        if (!claimed.add(key(url))) return false;
        frontier.addLast(new FrontierEntry(url, depth));
        return true;
    }

    /** 더 이상 꺼낼 것이 없는지(큐 비었음 또는 bound 도달) */
    public synchronized boolean isExhausted() {
        return !started || frontier.isEmpty() || dequeued >= pageBound;
    }

    public synchronized boolean isClaimed(String url) { return url != null && claimed.contains(key(url)); }
    public synchronized int pending() { return frontier.size(); }
    public synchronized int dequeuedCount() { return dequeued; }
    public synchronized int claimedCount() { return claimed.size(); }
    public synchronized int requestedDepth() { return requestedDepth; }
    public synchronized int pageBound() { return pageBound; }

    // URL이 아니면(테스트용 식별자 등) 문자열 그대로
    private static String key(String url) {
        String k = UrlUtils.visitKey(url);
        return (k == null) ? url : k;
    }

    private void ensureStarted() {
        if (!started) throw new IllegalStateException("scheduler not started");
    }
}

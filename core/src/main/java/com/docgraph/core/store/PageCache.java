package com.docgraph.core.store;

import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.util.UrlUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * fetch 결과 캐시: (정규화 URL, 모드) 키, 개수 상한(LRU) + 나이 기반 만료.
 * 성공 결과만 넣는다. 실패는 다음 호출에서 다시 시도해야 하므로 캐시하지 않는다.
 * TTL은 -Ddg.cache.ttlMinutes 로 덮어쓸 수 있다.
 */
public final class PageCache {

    public static final String TTL_PROPERTY = "dg.cache.ttlMinutes";

    private final int maxEntries;
    private final long ttlMs;
    private final CacheClock clock;
    private final Map<String, Entry> map;

    private long hits;
    private long misses;

    private record Entry(PageResult result, long expiresAt) {}

    public PageCache(int maxEntries, Duration ttl, CacheClock clock) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
        this.ttlMs = resolveTtl(ttl).toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        // access-order → 가장 오래 안 쓴 항목이 먼저 빠진다
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > PageCache.this.maxEntries;
            }
        };
    }

    public PageCache(int maxEntries, Duration ttl) {
        this(maxEntries, ttl, CacheClock.SYSTEM);
    }

    static Duration resolveTtl(Duration fallback) {
        String v = System.getProperty(TTL_PROPERTY);
        if (v != null && !v.isBlank()) {
            try {
                long m = Long.parseLong(v.trim());
                if (m >= 0) return Duration.ofMinutes(m);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(TTL_PROPERTY + " must be an integer: " + v, e);
            }
        }
        return (fallback == null || fallback.isNegative()) ? Duration.ZERO : fallback;
    }

    static String key(String url, ExtractMode mode) {
        String n = UrlUtils.normalize(url);
        return (mode == null ? ExtractMode.DOCUMENT : mode).wireName() + " " + (n == null ? url : n);
    }

    public synchronized Optional<PageResult> get(String url, ExtractMode mode) {
        String k = key(url, mode);
        Entry e = map.get(k);
        if (e == null) { misses++; return Optional.empty(); }
        if (e.expiresAt <= clock.nowMillis()) {
            map.remove(k);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(e.result);
    }

    public synchronized void put(String url, ExtractMode mode, PageResult result) {
        if (result == null || !result.isSucceeded() || ttlMs <= 0) return;
        map.put(key(url, mode), new Entry(result, clock.nowMillis() + ttlMs));
    }

    public synchronized void clear() { map.clear(); }
    public synchronized int size() { return map.size(); }
    public synchronized long hits() { return hits; }
    public synchronized long misses() { return misses; }
}

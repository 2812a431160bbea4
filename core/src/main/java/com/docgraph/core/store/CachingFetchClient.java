package com.docgraph.core.store;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/** 다른 fetch client 앞에 PageCache를 두는 래퍼. */
public final class CachingFetchClient implements IFetchClient {

    private static final Logger LOG = LoggerFactory.getLogger(CachingFetchClient.class);

    private final IFetchClient delegate;
    private final PageCache cache;

    public CachingFetchClient(IFetchClient delegate, PageCache cache) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public PageResult fetch(PageRequest req) {
        Optional<PageResult> hit = cache.get(req.url(), req.mode());
        if (hit.isPresent()) {
            LOG.debug("cache hit: {} ({})", req.url(), req.mode());
            return hit.get();
        }
        PageResult r = delegate.fetch(req);
        cache.put(req.url(), req.mode(), r);
        return r;
    }

    public PageCache cache() { return cache; }

    @Override
    public void close() throws Exception {
        delegate.close();
    }
}

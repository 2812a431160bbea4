package com.docgraph.core.crawler;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.model.StructuredContent;
import com.docgraph.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 요청 모드 → fetch client 호출 1회 → 모드별로 정리된 PageResult.
 * 네트워크/파싱 실패로 예외를 던지지 않는다: 실패는 succeeded=false + error 로 보고.
 * 캐시는 여기서 하지 않는다(저장소 쪽 CachingFetchClient 몫).
 */
public final class ExtractorDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractorDispatcher.class);

    private final IFetchClient client;

    public ExtractorDispatcher(IFetchClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public PageResult fetch(String url, ExtractMode mode) {
        final ExtractMode m = (mode == null ? ExtractMode.DOCUMENT : mode);
        if (url == null || url.isBlank()) {
            return PageResult.failure(String.valueOf(url), m, "url is blank");
        }

        PageResult raw;
        try {
            raw = client.fetch(PageRequest.of(url, m));
        } catch (RuntimeException e) {
            LOG.debug("fetch client threw for {}: {}", url, e.toString());
            return PageResult.failure(url, m, describe(e));
        }

        if (raw == null) {
            return PageResult.failure(url, m, "fetch client returned no result");
        }
        if (!raw.isSucceeded()) {
            return PageResult.failure(url, m, raw.getError().orElse("fetch failed"));
        }
        return shape(url, m, raw);
    }

    /** 모드별 보장 필드 정리 */
    private static PageResult shape(String url, ExtractMode mode, PageResult raw) {
        List<String> links = absoluteOnly(raw.getOutboundLinks());
        PageResult.Builder b = raw.toBuilder()
                .url(url)
                .mode(mode)
                .outboundLinks(links)
                .error(null);

        switch (mode) {
            case STRUCTURED -> {
                StructuredContent sc = (raw.getStructured() == null ? StructuredContent.empty() : raw.getStructured());
                String title = firstNonBlank(sc.title(), raw.getTitle());
                b.structured(sc.title().isBlank() ? sc.withTitle(title) : sc).title(title).text(null);
            }
            case DOCUMENT -> b.text(raw.getText() == null ? "" : raw.getText()).structured(null);
            case LINK_LIST -> b.text(null).structured(null);
        }
        return b.build();
    }

    /** 발견 순서 유지 + 상대 URL 제거(계약 위반분). 같은 링크가 반복되면 반복된 그대로 둔다. */
    private static List<String> absoluteOnly(List<String> links) {
        if (links == null || links.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(links.size());
        for (String l : links) {
            if (l == null) continue;
            String t = l.trim();
            if (UrlUtils.parseAbsolute(t) == null) continue;
            out.add(t);
        }
        return out;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) return a;
        return (b == null ? "" : b);
    }

    static String describe(Throwable t) {
        String m = t.getMessage();
        return t.getClass().getSimpleName() + (m == null || m.isBlank() ? "" : ": " + m);
    }
}

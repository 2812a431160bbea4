package com.docgraph.core.fetch;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.util.UrlUtils;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * jsoup 기반 fetch client: GET → HTML 파싱 → 모드별 본문.
 * 링크는 a[href]의 abs:href 중 http(s)만, 발견 순서대로.
 * 네트워크/HTTP 오류는 예외 대신 실패 결과로 돌려준다.
 */
public class JsoupFetchClient implements IFetchClient {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupFetchClient.class);

    private final int timeoutMs;
    private final boolean followRedirects;
    private final String userAgent;
    private final int maxBodyBytes;

    public JsoupFetchClient(CrawlConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.timeoutMs = cfg.getTimeoutMsInt();
        this.followRedirects = cfg.isFollowRedirects();
        this.userAgent = cfg.getUserAgent();
        this.maxBodyBytes = cfg.getMaxBodyBytes();
    }

    @Override
    public PageResult fetch(PageRequest req) {
        Objects.requireNonNull(req, "req");
        final String url = req.url();
        final ExtractMode mode = req.mode();

        Connection.Response res;
        Document doc;
        try {
            res = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(followRedirects)
                    .maxBodySize(maxBodyBytes)
                    .ignoreHttpErrors(false)
                    .execute();
            doc = res.parse();
        } catch (HttpStatusException e) {
            return PageResult.failure(url, mode, "HTTP " + e.getStatusCode());
        } catch (UnsupportedMimeTypeException e) {
            return PageResult.failure(url, mode, "unsupported content type: " + e.getMimeType());
        } catch (SocketTimeoutException e) {
            return PageResult.failure(url, mode, "timeout after " + timeoutMs + "ms");
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("jsoup fetch failed: {} -> {}", url, e.toString());
            return PageResult.failure(url, mode, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        return toResult(url, mode, doc, metadata(res, doc));
    }

    /** 이미 파싱된 문서 → 모드별 PageResult (Crawl4AI 대체 경로에서도 사용) */
    static PageResult toResult(String url, ExtractMode mode, Document doc, Map<String, String> meta) {
        PageResult.Builder b = PageResult.builder()
                .url(url)
                .mode(mode)
                .title(doc.title())
                .outboundLinks(links(doc))
                .metadata(meta);
        switch (mode) {
            case DOCUMENT -> b.text(MarkdownRenderer.render(doc));
            case STRUCTURED -> b.structured(StructuredExtractor.extract(doc));
            case LINK_LIST -> { }
        }
        return b.build();
    }

    static List<String> links(Document doc) {
        List<String> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            if (UrlUtils.parseAbsolute(abs.trim()) == null) continue; // mailto:, javascript: 등
            out.add(abs.trim());
        }
        return out;
    }

    private static Map<String, String> metadata(Connection.Response res, Document doc) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("status", String.valueOf(res.statusCode()));
        if (res.contentType() != null) m.put("content_type", res.contentType());
        if (!res.url().toString().isEmpty()) m.put("final_url", res.url().toString());
        Element desc = doc.selectFirst("meta[name=description]");
        if (desc != null && !desc.attr("content").isBlank()) m.put("description", desc.attr("content").trim());
        m.put("fetcher", "jsoup");
        return m;
    }
}

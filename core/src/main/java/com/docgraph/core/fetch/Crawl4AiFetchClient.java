package com.docgraph.core.fetch;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.model.StructuredContent;
import com.docgraph.core.util.Jsons;
import com.docgraph.core.util.UrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Crawl4AI 사이드카(REST, {@code POST /crawl})를 쓰는 fetch client.
 * 브라우저 렌더링은 사이드카가 하고, 여기서는 요청 조립과 응답 → PageResult 변환만 한다.
 *
 * <p>STRUCTURED: llmProvider가 설정돼 있으면 LLM 추출 스키마(title/main_concepts/code_examples/
 * api_methods/dependencies)를 함께 보낸다. 추출 결과가 없거나 깨져 있으면 응답 HTML에
 * {@link StructuredExtractor}를 돌려 대체한다.
 */
public class Crawl4AiFetchClient implements IFetchClient {

    private static final Logger LOG = LoggerFactory.getLogger(Crawl4AiFetchClient.class);

    static final String INSTRUCTION =
            "Extract the page title, the main concepts it explains, code examples, "
            + "public API methods (name and one-line description) and package dependencies.";

    private final URI endpoint;
    private final String llmProvider;
    private final String apiToken;
    private final Duration timeout;
    private final HttpClient http;
    private final ObjectMapper om;

    public Crawl4AiFetchClient(CrawlConfig cfg) {
        this(cfg, HttpClient.newBuilder()
                .connectTimeout(cfg.getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    Crawl4AiFetchClient(CrawlConfig cfg, HttpClient http) {
        Objects.requireNonNull(cfg, "cfg");
        String base = cfg.getCrawl4ai().getBaseUrl();
        if (base == null || base.isBlank()) throw new IllegalArgumentException("crawl4ai.baseUrl is required");
        this.endpoint = URI.create(base.endsWith("/") ? base + "crawl" : base + "/crawl");
        this.llmProvider = cfg.getCrawl4ai().getLlmProvider();
        this.apiToken = cfg.getCrawl4ai().getApiToken();
        this.timeout = cfg.getTimeout();
        this.http = Objects.requireNonNull(http, "http");
        // 공용 설정 그대로, 요청 본문만 한 줄로
        this.om = Jsons.mapper().disable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public PageResult fetch(PageRequest req) {
        Objects.requireNonNull(req, "req");
        final String url = req.url();
        final ExtractMode mode = req.mode();

        Crawl4AiResponse resp;
        try {
            String body = om.writeValueAsString(requestBody(url, mode));
            HttpRequest.Builder rb = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            if (!apiToken.isBlank()) rb.header("Authorization", "Bearer " + apiToken);

            HttpResponse<String> res = http.send(rb.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (res.statusCode() / 100 != 2) {
                return PageResult.failure(url, mode, "crawl4ai HTTP " + res.statusCode());
            }
            resp = om.readValue(res.body(), Crawl4AiResponse.class);
        } catch (HttpTimeoutException e) {
            return PageResult.failure(url, mode, "timeout after " + timeout.toMillis() + "ms");
        } catch (JsonProcessingException e) {
            return PageResult.failure(url, mode, "invalid crawl4ai response: " + e.getOriginalMessage());
        } catch (IOException e) {
            LOG.debug("crawl4ai request failed: {} -> {}", url, e.toString());
            return PageResult.failure(url, mode, "crawl4ai unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PageResult.failure(url, mode, "interrupted");
        }

        if (resp == null || resp.results().isEmpty()) {
            return PageResult.failure(url, mode, "crawl4ai returned no results");
        }
        Crawl4AiPageResult page = resp.results().get(0);
        if (!page.success()) {
            String err = (page.errorMessage() == null || page.errorMessage().isBlank())
                    ? "crawl4ai reported failure" : page.errorMessage();
            return PageResult.failure(url, mode, err);
        }
        return toResult(url, mode, page);
    }

    /* =========================
       요청/응답 변환
       ========================= */

    ObjectNode requestBody(String url, ExtractMode mode) {
        ObjectNode root = om.createObjectNode();
        root.putArray("urls").add(url);
        root.putObject("browser_config").put("type", "BrowserConfig")
                .putObject("params").put("headless", true);

        ObjectNode params = root.putObject("crawler_config").put("type", "CrawlerRunConfig").putObject("params");
        params.put("cache_mode", "bypass");
        if (mode == ExtractMode.STRUCTURED && !llmProvider.isBlank()) {
            ObjectNode strategy = params.putObject("extraction_strategy")
                    .put("type", "LLMExtractionStrategy")
                    .putObject("params");
            ObjectNode llm = strategy.putObject("llm_config").put("type", "LLMConfig").putObject("params");
            llm.put("provider", llmProvider);
            if (!apiToken.isBlank()) llm.put("api_token", apiToken);
            strategy.put("extraction_type", "schema");
            strategy.put("instruction", INSTRUCTION);
            strategy.set("schema", schema());
        }
        return root;
    }

    private ObjectNode schema() {
        ObjectNode s = om.createObjectNode().put("type", "object");
        ObjectNode props = s.putObject("properties");
        props.putObject("title").put("type", "string");
        props.putObject("main_concepts").put("type", "array").putObject("items").put("type", "string");
        props.putObject("code_examples").put("type", "array").putObject("items").put("type", "string");
        props.putObject("api_methods").put("type", "array").putObject("items").put("type", "object");
        props.putObject("dependencies").put("type", "array").putObject("items").put("type", "string");
        return s;
    }

    PageResult toResult(String url, ExtractMode mode, Crawl4AiPageResult page) {
        Map<String, String> meta = new LinkedHashMap<>();
        if (page.statusCode() != null) meta.put("status", String.valueOf(page.statusCode()));
        page.metadata().forEach((k, v) -> { if (v != null) meta.put(k, String.valueOf(v)); });
        meta.put("fetcher", "crawl4ai");

        PageResult.Builder b = PageResult.builder()
                .url(url)
                .mode(mode)
                .title(page.title())
                .outboundLinks(absolute(url, page.hrefs()))
                .metadata(meta);

        switch (mode) {
            case DOCUMENT -> b.text(page.markdownText());
            case STRUCTURED -> {
                StructuredContent sc = parseExtracted(page.extractedContent());
                if (sc == null && page.html() != null && !page.html().isBlank()) {
                    sc = StructuredExtractor.extract(Jsoup.parse(page.html(), url));
                }
                b.structured(sc == null ? StructuredContent.empty() : sc);
            }
            case LINK_LIST -> { }
        }
        return b.build();
    }

    /**
     * LLM 추출 결과(JSON 문자열) → StructuredContent. 비었거나 파싱 불가면 null.
     * 결과가 배열(청크별 블록)이면 모든 블록을 합친다.
     */
    StructuredContent parseExtracted(String json) {
        if (json == null || json.isBlank()) return null;
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            LOG.debug("extracted_content is not JSON: {}", e.getOriginalMessage());
            return null;
        }
        List<JsonNode> blocks = new ArrayList<>();
        if (root instanceof ArrayNode arr) arr.forEach(blocks::add);
        else if (root != null && root.isObject()) blocks.add(root);

        StructuredContent.Builder b = StructuredContent.builder();
        for (JsonNode blk : blocks) {
            if (!blk.isObject()) continue;
            String t = blk.path("title").asText("");
            if (!t.isBlank() && b.build().title().isBlank()) b.title(t);
            blk.path("main_concepts").forEach(n -> b.concept(n.asText()));
            blk.path("code_examples").forEach(n -> b.codeSample(n.asText()));
            blk.path("dependencies").forEach(n -> b.dependency(n.asText()));
            blk.path("api_methods").forEach(n -> {
                if (n.isTextual()) b.api(n.asText(), "");
                else b.api(firstText(n, "name", "method", "signature"), firstText(n, "description", "summary"));
            });
        }
        StructuredContent sc = b.build();
        return sc.isEmpty() ? null : sc;
    }

    private static String firstText(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return "";
    }

    private static List<String> absolute(String base, List<String> hrefs) {
        List<String> out = new ArrayList<>(hrefs.size());
        URI b = URI.create(base);
        for (String h : hrefs) {
            try {
                String abs = b.resolve(h).toString();
                if (UrlUtils.parseAbsolute(abs) != null) out.add(abs);
            } catch (IllegalArgumentException e) {
                LOG.trace("skip unparsable href {}: {}", h, e.getMessage());
            }
        }
        return out;
    }
}

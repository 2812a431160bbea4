package com.docgraph.core.util;

import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.CrawlConfig.FetcherType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * docgraph.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 15000
 * concurrency: 1
 * rps: 10
 * followRedirects: true
 * userAgent: "docgraph/0.1 (+crawler)"
 * maxBodyBytes: 5242880
 * fetcher: jsoup | crawl4ai
 * scope:
 *   maxDepth: 2
 *   pageBound: 50
 *   patterns: ["/api/", "/guide/"]
 *
 * crawl4ai:
 *   baseUrl: "http://localhost:11235"
 *   llmProvider: "openai/gpt-4o-mini"
 *   apiToken: ""
 *
 * store:
 *   enabled: true
 *   dir: "out/graphs"
 *
 * cache:
 *   enabled: true
 *   maxEntries: 256
 *   ttlMinutes: 30
 *
 * 환경 변수가 있으면 YAML 값보다 우선한다(토큰을 파일에 두지 않기 위해):
 * DG_CRAWL4AI_URL, DG_CRAWL4AI_TOKEN, DG_LLM_PROVIDER
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "docgraph.yml";

    static final String ENV_CRAWL4AI_URL = "DG_CRAWL4AI_URL";
    static final String ENV_CRAWL4AI_TOKEN = "DG_CRAWL4AI_TOKEN";
    static final String ENV_LLM_PROVIDER = "DG_LLM_PROVIDER";

    private YamlConfigLoader() {}

    /** 파일이 없으면 defaults() */
    public static CrawlConfig loadOrDefaults(Path yamlPath) throws IOException {
        if (yamlPath == null || !Files.exists(yamlPath)) {
            CrawlConfig cfg = CrawlConfig.defaults();
            applyEnv(cfg, System.getenv());
            cfg.validate();
            return cfg;
        }
        return load(yamlPath);
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlConfig load(InputStream in) throws IOException {
        return load(in, System.getenv());
    }

    static CrawlConfig load(InputStream in, Map<String, String> env) throws IOException {
        Objects.requireNonNull(in, "in");
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root;
        try {
            root = yaml.load(in);
        } catch (RuntimeException e) {
            throw new IOException("invalid YAML: " + e.getMessage(), e);
        }

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            applyEnv(cfg, env);
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setIntAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setInt(map, "concurrency", cfg::setConcurrency);
        setInt(map, "rps", cfg::setRps);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "maxBodyBytes", cfg::setMaxBodyBytes);
        setEnum(map, "fetcher", FetcherType.class, cfg::setFetcher);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "pageBound", cfg::setPageBound);
            setStringList(scope, "patterns", cfg::setPatterns);
        }

        // 3) crawl4ai.*
        Map<String, Object> c4 = getMap(map, "crawl4ai");
        if (c4 != null) {
            var c = cfg.getCrawl4ai();
            setString(c4, "baseUrl", c::setBaseUrl);
            setString(c4, "llmProvider", c::setLlmProvider);
            setString(c4, "apiToken", c::setApiToken);
        }

        // 4) store.*
        Map<String, Object> store = getMap(map, "store");
        if (store != null) {
            var s = cfg.getStore();
            setBoolean(store, "enabled", s::setEnabled);
            setPath(store, "dir", s::setDir);
        }

        // 5) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.getCache();
            setBoolean(cache, "enabled", c::setEnabled);
            setInt(cache, "maxEntries", c::setMaxEntries);
            setInt(cache, "ttlMinutes", c::setTtlMinutes);
        }

        applyEnv(cfg, env);

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    static void applyEnv(CrawlConfig cfg, Map<String, String> env) {
        if (env == null) return;
        var c = cfg.getCrawl4ai();
        setString(env, ENV_CRAWL4AI_URL, c::setBaseUrl);
        setString(env, ENV_CRAWL4AI_TOKEN, c::setApiToken);
        setString(env, ENV_LLM_PROVIDER, c::setLlmProvider);
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null && !String.valueOf(v).isBlank()) setter.accept(String.valueOf(v).trim());
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            String[] parts = s.split("\\s*,\\s*");
            List<String> out = new ArrayList<>();
            for (String p : parts) if (!p.isEmpty()) out.add(p);
            setter.accept(List.copyOf(out));
        }
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) {
            try {
                setter.accept(Integer.parseInt(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer: " + v, e);
            }
        }
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s.replace('-', '_'))) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException(key + ": unknown value '" + s + "', expected one of "
                + java.util.Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT));
    }
}

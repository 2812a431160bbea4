package com.docgraph.core.cli;

import com.docgraph.core.export.GraphJsonExporter;
import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.DocumentResponse;
import com.docgraph.core.model.GraphResponse;
import com.docgraph.core.service.KnowledgeGraphService;
import com.docgraph.core.util.Jsons;
import com.docgraph.core.util.LogSetup;
import com.docgraph.core.util.YamlConfigLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * 명령줄 진입점. 결과는 JSON으로 stdout에 쓴다.
 * <pre>
 * docgraph [--config docgraph.yml] crawl   &lt;url&gt; [markdown|structured|links]
 * docgraph [--config docgraph.yml] extend  &lt;framework&gt; &lt;baseUrl&gt; [depth] [/api/,/guide/]
 * docgraph [--config docgraph.yml] graph   [framework]
 * docgraph [--config docgraph.yml] catalog
 * docgraph [--config docgraph.yml] export  &lt;framework&gt; &lt;dir&gt;
 * docgraph prompt &lt;framework&gt; &lt;docsUrl&gt;
 * </pre>
 * 종료 코드: 0 성공, 1 작업 실패, 2 사용법 오류.
 */
public final class DocGraphCli {

    private static final Logger LOG = LoggerFactory.getLogger(DocGraphCli.class);

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final Function<CrawlConfig, KnowledgeGraphService> serviceFactory;
    private final ObjectMapper om = Jsons.mapper();

    public DocGraphCli() {
        this(KnowledgeGraphService::create);
    }

    DocGraphCli(Function<CrawlConfig, KnowledgeGraphService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    public static void main(String[] args) {
        Path outRoot = Path.of(System.getProperty("dg.out.dir", "out"));
        LogSetup.configure(outRoot);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));
        System.exit(new DocGraphCli().run(args, System.out, System.err));
    }

    int run(String[] argv, PrintStream out, PrintStream err) {
        List<String> args = new ArrayList<>(Arrays.asList(argv));
        Path configPath = Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (args.size() >= 2 && args.get(0).equals("--config")) {
            configPath = Path.of(args.get(1));
            args = args.subList(2, args.size());
        }
        if (args.isEmpty()) return usage(err, "missing command");

        String cmd = args.get(0);
        List<String> rest = args.subList(1, args.size());

        CrawlConfig cfg;
        try {
            cfg = YamlConfigLoader.loadOrDefaults(configPath);
        } catch (IOException | IllegalArgumentException e) {
            err.println("config error: " + e.getMessage());
            return FAILED;
        }

        try (KnowledgeGraphService svc = serviceFactory.apply(cfg)) {
            switch (cmd) {
                case "crawl": {
                    if (rest.isEmpty()) return usage(err, "crawl <url> [type]");
                    DocumentResponse r = svc.crawlDocumentation(rest.get(0), rest.size() > 1 ? rest.get(1) : null);
                    print(out, r);
                    return r.success() ? OK : FAILED;
                }
                case "extend": {
                    if (rest.size() < 2) return usage(err, "extend <framework> <baseUrl> [depth] [patterns]");
                    int depth = KnowledgeGraphService.DEFAULT_DEPTH;
                    if (rest.size() > 2) {
                        try {
                            depth = Integer.parseInt(rest.get(2).trim());
                        } catch (NumberFormatException e) {
                            return usage(err, "depth must be an integer: " + rest.get(2));
                        }
                    }
                    List<String> patterns = rest.size() > 3 ? Arrays.asList(rest.get(3).split("\\s*,\\s*")) : null;
                    GraphResponse r = svc.extendKnowledgeGraph(rest.get(0), rest.get(1), depth, patterns);
                    print(out, r);
                    return r.success() ? OK : FAILED;
                }
                case "graph": {
                    GraphResponse r = rest.isEmpty() ? svc.getKnowledgeGraph() : svc.getKnowledgeGraph(rest.get(0));
                    print(out, r);
                    return r.success() ? OK : FAILED;
                }
                case "catalog":
                    print(out, svc.catalog());
                    return OK;
                case "export": {
                    if (rest.size() < 2) return usage(err, "export <framework> <dir>");
                    GraphResponse r = svc.getKnowledgeGraph(rest.get(0));
                    if (!r.success() || r.graph().isEmpty()) {
                        err.println("no stored graph for " + rest.get(0));
                        return FAILED;
                    }
                    Path file = new GraphJsonExporter().export(Path.of(rest.get(1)), r.graph());
                    out.println(file.toAbsolutePath());
                    return OK;
                }
                case "prompt": {
                    if (rest.size() < 2) return usage(err, "prompt <framework> <docsUrl>");
                    out.print(svc.analyzeFrameworkPrompt(rest.get(0), rest.get(1)));
                    return OK;
                }
                default:
                    return usage(err, "unknown command: " + cmd);
            }
        } catch (Exception e) {
            LOG.error("Command '{}' failed", cmd, e);
            err.println("error: " + e.getMessage());
            return FAILED;
        }
    }

    private void print(PrintStream out, Object value) throws IOException {
        out.println(om.writeValueAsString(value));
    }

    private static int usage(PrintStream err, String problem) {
        err.println("usage error: " + problem);
        err.println("commands: crawl | extend | graph | catalog | export | prompt");
        return USAGE;
    }
}

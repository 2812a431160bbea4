package com.docgraph.core.cli;

import com.docgraph.core.api.IFetchClient;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.model.StructuredContent;
import com.docgraph.core.service.KnowledgeGraphService;
import com.docgraph.core.store.InMemoryGraphStore;
import com.docgraph.core.util.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DocGraphCliTest {

    static final String ROOT = "https://ex.com/docs/";

    @TempDir Path tmp;

    final InMemoryGraphStore store = new InMemoryGraphStore();
    final Map<String, List<String>> site = Map.of(
            ROOT, List.of(ROOT + "api/a", ROOT + "guide/b"),
            ROOT + "api/a", List.of(),
            ROOT + "guide/b", List.of());

    final IFetchClient client = req -> site.containsKey(req.url())
            ? PageResult.builder().url(req.url()).mode(req.mode()).title("T").text("# T")
                .structured(StructuredContent.builder().concept("C").build())
                .outboundLinks(site.get(req.url())).build()
            : PageResult.failure(req.url(), req.mode(), "HTTP 404");

    ByteArrayOutputStream outBuf;
    ByteArrayOutputStream errBuf;
    DocGraphCli cli;
    Path noConfig;

    @BeforeEach
    void setUp() {
        outBuf = new ByteArrayOutputStream();
        errBuf = new ByteArrayOutputStream();
        cli = new DocGraphCli(cfg -> new KnowledgeGraphService(cfg.setRps(1000), client, store));
        noConfig = tmp.resolve("absent.yml");
    }

    private int run(String... args) {
        String[] argv = new String[args.length + 2];
        argv[0] = "--config";
        argv[1] = noConfig.toString();
        System.arraycopy(args, 0, argv, 2, args.length);
        return cli.run(argv,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void noCommand_isUsageError() {
        assertThat(run()).isEqualTo(DocGraphCli.USAGE);
        assertThat(err()).contains("missing command");
    }

    @Test
    void unknownCommand_isUsageError() {
        assertThat(run("serve")).isEqualTo(DocGraphCli.USAGE);
        assertThat(err()).contains("unknown command: serve");
    }

    @Test
    void extend_nonIntegerDepth_isUsageError() {
        assertThat(run("extend", "Lib", ROOT, "deep")).isEqualTo(DocGraphCli.USAGE);
        assertThat(store.frameworks()).isEmpty();
    }

    @Test
    void extend_printsGraphJson_andStores() throws Exception {
        assertThat(run("extend", "Lib", ROOT, "1", "/api/")).isEqualTo(DocGraphCli.OK);

        JsonNode r = Jsons.mapper().readTree(out());
        assertThat(r.get("success").asBoolean()).isTrue();
        assertThat(r.get("persisted").asBoolean()).isTrue();
        assertThat(r.get("graph").get("nodes").size()).isEqualTo(2);
        assertThat(r.get("graph").get("base_url").asText()).isEqualTo(ROOT);
        assertThat(store.frameworks()).containsExactly("Lib");
    }

    @Test
    void graph_and_catalog_readStore() throws Exception {
        run("extend", "Lib", ROOT, "1");
        outBuf.reset();

        assertThat(run("graph", "Lib")).isEqualTo(DocGraphCli.OK);
        assertThat(Jsons.mapper().readTree(out()).get("graph").get("nodes").size()).isEqualTo(3);
        outBuf.reset();

        assertThat(run("catalog")).isEqualTo(DocGraphCli.OK);
        JsonNode c = Jsons.mapper().readTree(out());
        assertThat(c.get("frameworks").get(0).asText()).isEqualTo("Lib");
        assertThat(c.get("total_nodes").asInt()).isEqualTo(3);
    }

    @Test
    void crawl_failure_exitsWithFailure() throws Exception {
        assertThat(run("crawl", "https://ex.com/missing")).isEqualTo(DocGraphCli.FAILED);
        JsonNode r = Jsons.mapper().readTree(out());
        assertThat(r.get("success").asBoolean()).isFalse();
        assertThat(r.get("error").get("stage").asText()).isEqualTo("fetch");
    }

    @Test
    void crawl_links_printsLinks() throws Exception {
        assertThat(run("crawl", ROOT, "links")).isEqualTo(DocGraphCli.OK);
        JsonNode r = Jsons.mapper().readTree(out());
        assertThat(r.get("links").size()).isEqualTo(2);
        assertThat(r.has("content")).isFalse();
    }

    @Test
    void export_writesFile() {
        run("extend", "Lib", ROOT, "1");
        outBuf.reset();
        Path dir = tmp.resolve("exports");

        assertThat(run("export", "Lib", dir.toString())).isEqualTo(DocGraphCli.OK);
        assertThat(Files.exists(dir.resolve("lib-graph.json"))).isTrue();
        assertThat(out().trim()).endsWith("lib-graph.json");
    }

    @Test
    void export_unknownFramework_fails() {
        assertThat(run("export", "Nope", tmp.toString())).isEqualTo(DocGraphCli.FAILED);
        assertThat(err()).contains("no stored graph for Nope");
    }

    @Test
    void prompt_printsAnalysisPrompt() {
        assertThat(run("prompt", "Django", "https://docs.djangoproject.com/")).isEqualTo(DocGraphCli.OK);
        assertThat(out()).contains("framework_name: \"Django\"", "base_url: \"https://docs.djangoproject.com/\"");
    }

    @Test
    void badConfig_exitsWithFailure() throws Exception {
        Path cfg = tmp.resolve("bad.yml");
        Files.writeString(cfg, "fetcher: selenium\n");
        int code = cli.run(new String[]{"--config", cfg.toString(), "catalog"},
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
        assertThat(code).isEqualTo(DocGraphCli.FAILED);
        assertThat(err()).startsWith("config error:");
    }
}

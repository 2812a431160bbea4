package com.docgraph.core.fetch;

import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.PageRequest;
import com.docgraph.core.model.PageResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupFetchClientTest {

    static HttpServer s;
    static String base;

    @BeforeAll
    static void up() throws IOException {
        s = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        s.createContext("/docs/", ex -> respond(ex, 200, "text/html; charset=utf-8", DocFixtures.GUIDE));
        s.createContext("/missing", ex -> respond(ex, 404, "text/html", "<html>nope</html>"));
        s.createContext("/image.png", ex -> respond(ex, 200, "image/png", "PNG"));
        s.createContext("/slow", ex -> {
            try { Thread.sleep(2_000); } catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            respond(ex, 200, "text/html", "<html>late</html>");
        });
        s.setExecutor(Executors.newCachedThreadPool());
        s.start();
        base = "http://localhost:" + s.getAddress().getPort();
    }

    @AfterAll
    static void down() {
        s.stop(0);
    }

    static void respond(HttpExchange ex, int status, String type, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", type);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
    }

    private static JsoupFetchClient client(long timeoutMs) {
        return new JsoupFetchClient(CrawlConfig.defaults().setTimeoutMs(timeoutMs));
    }

    @Test
    void documentMode_markdownAndMetadata() {
        PageResult r = client(5_000).fetch(PageRequest.of(base + "/docs/", ExtractMode.DOCUMENT));

        assertThat(r.isSucceeded()).isTrue();
        assertThat(r.getTitle()).isEqualTo("Lib Docs");
        assertThat(r.getText()).startsWith("# Lib Guide");
        assertThat(r.getMetadata())
                .containsEntry("status", "200")
                .containsEntry("description", "Lib reference")
                .containsEntry("fetcher", "jsoup");
        assertThat(r.getMetadata().get("content_type")).startsWith("text/html");
    }

    @Test
    void links_absoluteHttpOnly_inDocumentOrder() {
        PageResult r = client(5_000).fetch(PageRequest.of(base + "/docs/", ExtractMode.LINK_LIST));

        assertThat(r.getOutboundLinks()).containsExactly(
                base + "/nav",
                base + "/docs/api/session.html",
                base + "/docs/#frag",
                "https://other.org/x");
    }

    @Test
    void links_repeatedTargetsKept() {
        var doc = Jsoup.parse("<a href='api/a'>1</a><p><a href='api/a'>again</a><a href='/b'>b</a>",
                "https://ex.com/docs/");
        assertThat(JsoupFetchClient.links(doc)).containsExactly(
                "https://ex.com/docs/api/a", "https://ex.com/docs/api/a", "https://ex.com/b");
    }

    @Test
    void structuredMode_usesExtractor() {
        PageResult r = client(5_000).fetch(PageRequest.of(base + "/docs/", ExtractMode.STRUCTURED));
        assertThat(r.getStructured()).isNotNull();
        assertThat(r.getStructured().title()).isEqualTo("Lib Guide");
        assertThat(r.getStructured().concepts()).contains("Installation");
    }

    @Test
    void httpError_isFailure() {
        PageResult r = client(5_000).fetch(PageRequest.of(base + "/missing", ExtractMode.DOCUMENT));
        assertThat(r.isSucceeded()).isFalse();
        assertThat(r.getError()).contains("HTTP 404");
    }

    @Test
    void nonHtml_isFailure() {
        PageResult r = client(5_000).fetch(PageRequest.of(base + "/image.png", ExtractMode.DOCUMENT));
        assertThat(r.isSucceeded()).isFalse();
        assertThat(r.getError().orElse("")).startsWith("unsupported content type");
    }

    @Test
    void readTimeout_isFailure() {
        PageResult r = client(300).fetch(PageRequest.of(base + "/slow", ExtractMode.DOCUMENT));
        assertThat(r.isSucceeded()).isFalse();
        assertThat(r.getError().orElse("")).startsWith("timeout");
    }

    @Test
    void unreachableHost_isFailure() {
        PageResult r = client(1_000).fetch(PageRequest.of("http://localhost:1/", ExtractMode.DOCUMENT));
        assertThat(r.isSucceeded()).isFalse();
    }
}

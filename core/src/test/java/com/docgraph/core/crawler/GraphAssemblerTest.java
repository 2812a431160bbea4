package com.docgraph.core.crawler;

import com.docgraph.core.model.ExtractMode;
import com.docgraph.core.model.GraphEdge;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.PageResult;
import com.docgraph.core.model.StructuredContent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphAssemblerTest {

    private static PageResult ok(String url) {
        return PageResult.builder()
                .url(url)
                .mode(ExtractMode.STRUCTURED)
                .title("Title " + url)
                .structured(StructuredContent.builder().concept("Sessions").api("get(url)", "GET request").build())
                .build();
    }

    @Test
    void recordNode_copiesStructuredFields() {
        GraphAssembler a = new GraphAssembler("requests", "https://ex.com/");
        assertThat(a.recordNode("https://ex.com/", 0, ok("https://ex.com/"))).isTrue();
        KnowledgeGraph g = a.finalizeGraph();
        var n = g.node("https://ex.com/").orElseThrow();
        assertThat(n.title()).isEqualTo("Title https://ex.com/");
        assertThat(n.concepts()).containsExactly("Sessions");
        assertThat(n.apiSurface()).hasSize(1);
        assertThat(n.depth()).isZero();
    }

    @Test
    void failedResult_isNoOp() {
        GraphAssembler a = new GraphAssembler("fw", "https://ex.com/");
        assertThat(a.recordNode("https://ex.com/x", 1,
                PageResult.failure("https://ex.com/x", ExtractMode.STRUCTURED, "HTTP 404"))).isFalse();
        assertThat(a.nodeCount()).isZero();
    }

    @Test
    void duplicateNode_isRejected() {
        GraphAssembler a = new GraphAssembler("fw", "https://ex.com/");
        a.recordNode("https://ex.com/", 0, ok("https://ex.com/"));
        assertThatThrownBy(() -> a.recordNode("https://ex.com/", 1, ok("https://ex.com/")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void edges_appendOnly_duplicatesKept() {
        GraphAssembler a = new GraphAssembler("fw", "https://ex.com/");
        a.recordEdge("https://ex.com/", "https://ex.com/api/a");
        a.recordEdge("https://ex.com/", "https://ex.com/api/a");
        KnowledgeGraph g = a.finalizeGraph();
        assertThat(g.relationships()).containsExactly(
                GraphEdge.references("https://ex.com/", "https://ex.com/api/a"),
                GraphEdge.references("https://ex.com/", "https://ex.com/api/a"));
        assertThat(g.relationships().get(0).type()).isEqualTo("references");
    }

    @Test
    void finalize_isIdempotent_andClosesAssembler() {
        GraphAssembler a = new GraphAssembler("fw", "https://ex.com/");
        a.recordNode("https://ex.com/", 0, ok("https://ex.com/"));
        KnowledgeGraph g1 = a.finalizeGraph();
        KnowledgeGraph g2 = a.finalizeGraph();
        assertThat(g2).isSameAs(g1);
        assertThat(a.isFinalized()).isTrue();
        assertThatThrownBy(() -> a.recordEdge("x", "y")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> a.recordNode("https://ex.com/z", 1, ok("https://ex.com/z")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyGraph_hasFrameworkAndBase() {
        KnowledgeGraph g = new GraphAssembler("fw", "https://ex.com/").finalizeGraph();
        assertThat(g.framework()).isEqualTo("fw");
        assertThat(g.baseUrl()).isEqualTo("https://ex.com/");
        assertThat(g.isEmpty()).isTrue();
    }
}

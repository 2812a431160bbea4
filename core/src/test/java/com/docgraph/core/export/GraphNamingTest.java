package com.docgraph.core.export;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GraphNamingTest {

    @Test
    void slug_isFileSystemSafe() {
        assertThat(GraphNaming.slug("Spring Boot 3.x")).isEqualTo("spring-boot-3.x");
        assertThat(GraphNaming.slug("  ../etc/passwd ")).isEqualTo("etc-passwd");
        assertThat(GraphNaming.slug("C#/.NET")).isEqualTo("c-.net");
    }

    @Test
    void slug_blankOrSymbolsOnly_fallsBack() {
        assertThat(GraphNaming.slug(null)).isEqualTo("unnamed");
        assertThat(GraphNaming.slug("   ")).isEqualTo("unnamed");
        assertThat(GraphNaming.slug("///")).isEqualTo("unnamed");
    }

    @Test
    void slug_truncatedTo60() {
        assertThat(GraphNaming.slug("a".repeat(100))).hasSize(60);
    }

    @Test
    void fileName_addsSuffix() {
        assertThat(GraphNaming.fileName("FastAPI")).isEqualTo("fastapi-graph.json");
    }
}

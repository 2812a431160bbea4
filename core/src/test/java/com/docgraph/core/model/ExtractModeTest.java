package com.docgraph.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractModeTest {

    @Test
    void fromWireName_knownNames() {
        assertThat(ExtractMode.fromWireName("markdown")).isEqualTo(ExtractMode.DOCUMENT);
        assertThat(ExtractMode.fromWireName(" Structured ")).isEqualTo(ExtractMode.STRUCTURED);
        assertThat(ExtractMode.fromWireName("links")).isEqualTo(ExtractMode.LINK_LIST);
        assertThat(ExtractMode.fromWireName("link_list")).isEqualTo(ExtractMode.LINK_LIST);
    }

    @Test
    void fromWireName_unknownOrMissing_isDocument() {
        assertThat(ExtractMode.fromWireName(null)).isEqualTo(ExtractMode.DOCUMENT);
        assertThat(ExtractMode.fromWireName("")).isEqualTo(ExtractMode.DOCUMENT);
        assertThat(ExtractMode.fromWireName("pdf")).isEqualTo(ExtractMode.DOCUMENT);
    }
}

package com.docgraph.core.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Crawl4AI {@code POST /crawl} 최상위 응답 */
@JsonIgnoreProperties(ignoreUnknown = true)
record Crawl4AiResponse(boolean success, List<Crawl4AiPageResult> results) {
    Crawl4AiResponse {
        results = (results == null) ? List.of() : List.copyOf(results);
    }
}

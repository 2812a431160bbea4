package com.docgraph.core.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Crawl4AI 응답의 링크 1건 */
@JsonIgnoreProperties(ignoreUnknown = true)
record Crawl4AiLink(String href, String text) {}

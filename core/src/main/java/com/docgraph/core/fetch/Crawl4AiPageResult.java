package com.docgraph.core.fetch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 페이지 1건의 결과.
 * markdown은 버전에 따라 문자열이거나 {raw_markdown, fit_markdown} 객체라서 JsonNode로 받는다.
 * extracted_content는 LLM 추출 결과 JSON이 문자열로 들어온다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record Crawl4AiPageResult(
        String url,
        boolean success,
        @JsonProperty("status_code") Integer statusCode,
        JsonNode markdown,
        String html,
        @JsonProperty("extracted_content") String extractedContent,
        Map<String, List<Crawl4AiLink>> links,
        Map<String, Object> metadata,
        @JsonProperty("error_message") String errorMessage
) {
    Crawl4AiPageResult {
        links = (links == null) ? Map.of() : Map.copyOf(links);
        metadata = (metadata == null) ? Map.of() : metadata;
    }

    /** fit_markdown → raw_markdown → 문자열 markdown 순 */
    String markdownText() {
        if (markdown == null || markdown.isNull()) return "";
        if (markdown.isTextual()) return markdown.asText();
        for (String f : new String[]{"fit_markdown", "raw_markdown"}) {
            JsonNode n = markdown.get(f);
            if (n != null && n.isTextual() && !n.asText().isBlank()) return n.asText();
        }
        return "";
    }

    /** internal → external 순, href만 */
    List<String> hrefs() {
        List<String> out = new ArrayList<>();
        for (String kind : new String[]{"internal", "external"}) {
            for (Crawl4AiLink l : links.getOrDefault(kind, List.of())) {
                if (l != null && l.href() != null && !l.href().isBlank()) out.add(l.href().trim());
            }
        }
        return out;
    }

    String title() {
        Object t = metadata.get("title");
        return (t == null) ? "" : String.valueOf(t);
    }
}

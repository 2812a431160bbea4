package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * crawlDocumentation 응답: {url, title, content | links, metadata, success, error}.
 * content는 markdown이면 문자열, structured면 {@link StructuredContent}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"url", "title", "content", "links", "metadata", "success", "error"})
public record DocumentResponse(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("content") Object content,
        @JsonProperty("links") List<String> links,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("success") boolean success,
        @JsonProperty("error") OperationError error
) {
    public static DocumentResponse from(PageResult r) {
        if (!r.isSucceeded()) {
            return failed(r.getUrl(), OperationError.STAGE_FETCH, r.getError().orElse("fetch failed"));
        }
        return switch (r.getMode()) {
            case DOCUMENT -> new DocumentResponse(r.getUrl(), r.getTitle(), r.getText(), List.of(),
                    r.getMetadata(), true, null);
            case STRUCTURED -> new DocumentResponse(r.getUrl(), r.getTitle(), r.getStructured(), List.of(),
                    r.getMetadata(), true, null);
            case LINK_LIST -> new DocumentResponse(r.getUrl(), r.getTitle(), null, r.getOutboundLinks(),
                    r.getMetadata(), true, null);
        };
    }

    public static DocumentResponse failed(String url, String stage, String message) {
        return new DocumentResponse(url, null, null, null, null, false, new OperationError(stage, url, message));
    }
}

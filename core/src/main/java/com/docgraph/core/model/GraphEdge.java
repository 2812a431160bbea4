package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 페이지 간 참조 관계. to는 발견된 링크 원문(query/fragment 유지)이며
 * 대응하는 노드가 없을 수도 있다(bound에 먼저 걸린 경우).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphEdge(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("type") String type
) {
    public static final String REFERENCES = "references";

    public GraphEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        type = (type == null || type.isBlank()) ? REFERENCES : type;
    }

    public static GraphEdge references(String from, String to) {
        return new GraphEdge(from, to, REFERENCES);
    }
}

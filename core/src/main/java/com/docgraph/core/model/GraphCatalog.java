package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** 저장소 요약: 프레임워크 목록, 전체 노드 수, 마지막 갱신 시각(없으면 null). */
public record GraphCatalog(
        @JsonProperty("frameworks") List<String> frameworks,
        @JsonProperty("total_nodes") int totalNodes,
        @JsonProperty("last_updated") Instant lastUpdated
) {
    public GraphCatalog {
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
    }

    public static GraphCatalog empty() { return new GraphCatalog(List.of(), 0, null); }
}

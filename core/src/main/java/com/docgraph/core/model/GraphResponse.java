package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 그래프 작업 응답.
 * - success=false + error : 작업 전체 실패(검증/저장소 등). graph는 그 시점까지의 값(없으면 빈 그래프).
 * - pageFailures          : 개별 페이지 실패. 탐색은 성공일 수 있다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "graph", "page_failures", "error", "cancelled", "persisted"})
public record GraphResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("graph") KnowledgeGraph graph,
        @JsonProperty("page_failures") List<PageFailure> pageFailures,
        @JsonProperty("error") OperationError error,
        @JsonProperty("cancelled") boolean cancelled,
        @JsonProperty("persisted") boolean persisted
) {
    public GraphResponse {
        pageFailures = pageFailures == null ? List.of() : List.copyOf(pageFailures);
    }

    public static GraphResponse ok(KnowledgeGraph graph, List<PageFailure> failures, boolean cancelled, boolean persisted) {
        return new GraphResponse(true, graph, failures, null, cancelled, persisted);
    }

    public static GraphResponse failed(KnowledgeGraph graph, List<PageFailure> failures, OperationError error) {
        return new GraphResponse(false, graph, failures, error, false, false);
    }
}

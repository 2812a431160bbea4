package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 한 번의 탐색이 만든 불변 스냅샷.
 * JSON: {framework, base_url, nodes: {url: node}, relationships: [edge], created_at}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"framework", "base_url", "nodes", "relationships", "created_at"})
public record KnowledgeGraph(
        @JsonProperty("framework") String framework,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("nodes") Map<String, GraphNode> nodes,
        @JsonProperty("relationships") List<GraphEdge> relationships,
        @JsonProperty("created_at") Instant createdAt
) {
    public KnowledgeGraph {
        Objects.requireNonNull(framework, "framework");
        baseUrl = (baseUrl == null ? "" : baseUrl);
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        createdAt = (createdAt == null ? Instant.now() : createdAt);
    }

    /** 저장된 그래프가 없을 때 돌려주는 값. */
    public static KnowledgeGraph empty(String framework, String baseUrl) {
        return new KnowledgeGraph(framework == null ? "" : framework, baseUrl, Map.of(), List.of(), null);
    }

    public Optional<GraphNode> node(String url) {
        return Optional.ofNullable(nodes.get(url));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && relationships.isEmpty();
    }

    @JsonIgnore
    public int nodeCount() { return nodes.size(); }

    @JsonIgnore
    public int edgeCount() { return relationships.size(); }
}

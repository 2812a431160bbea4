package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 성공적으로 fetch된 URL 하나당 정확히 하나. 생성 후 불변. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphNode(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("concepts") Set<String> concepts,
        @JsonProperty("api_surface") List<ApiEntry> apiSurface,
        @JsonProperty("code_samples") List<String> codeSamples,
        @JsonProperty("depth") int depth
) {
    public GraphNode {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        title = (title == null ? "" : title);
        concepts = concepts == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(concepts));
        apiSurface = apiSurface == null ? List.of() : List.copyOf(apiSurface);
        codeSamples = codeSamples == null ? List.of() : List.copyOf(codeSamples);
    }

    public static GraphNode of(String url, int depth, String title, StructuredContent content) {
        StructuredContent c = (content == null ? StructuredContent.empty() : content);
        return new GraphNode(url, title, c.concepts(), c.apiSurface(), c.codeSamples(), depth);
    }
}

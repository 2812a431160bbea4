package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * STRUCTURED 모드의 추출 필드.
 * 채우는 방법은 fetch client 몫이고, 코어는 불투명 payload로 취급한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructuredContent(
        @JsonProperty("title") String title,
        @JsonProperty("concepts") Set<String> concepts,
        @JsonProperty("api_surface") List<ApiEntry> apiSurface,
        @JsonProperty("code_samples") List<String> codeSamples,
        @JsonProperty("dependencies") List<String> dependencies
) {
    public StructuredContent {
        title = (title == null ? "" : title);
        concepts = concepts == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(concepts));
        apiSurface = apiSurface == null ? List.of() : List.copyOf(apiSurface);
        codeSamples = codeSamples == null ? List.of() : List.copyOf(codeSamples);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static StructuredContent empty() {
        return new StructuredContent("", Set.of(), List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return title.isBlank() && concepts.isEmpty() && apiSurface.isEmpty()
                && codeSamples.isEmpty() && dependencies.isEmpty();
    }

    public StructuredContent withTitle(String t) {
        return new StructuredContent(t, concepts, apiSurface, codeSamples, dependencies);
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String title = "";
        private final Set<String> concepts = new LinkedHashSet<>();
        private final List<ApiEntry> api = new ArrayList<>();
        private final List<String> samples = new ArrayList<>();
        private final List<String> deps = new ArrayList<>();

        public Builder title(String t) { this.title = t; return this; }
        public Builder concept(String c) { if (c != null && !c.isBlank()) concepts.add(c.trim()); return this; }
        public Builder api(String name, String description) {
            if (name != null && !name.isBlank()) api.add(new ApiEntry(name, description));
            return this;
        }
        public Builder codeSample(String s) { if (s != null && !s.isBlank()) samples.add(s); return this; }
        public Builder dependency(String d) {
            if (d != null && !d.isBlank() && !deps.contains(d.trim())) deps.add(d.trim());
            return this;
        }
        public StructuredContent build() {
            return new StructuredContent(title, concepts, api, samples, deps);
        }
    }
}

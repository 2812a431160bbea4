package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** API 표면 항목(이름 + 설명). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEntry(String name, String description) {
    public ApiEntry {
        name = (name == null ? "" : name.trim());
        description = (description == null ? "" : description.trim());
    }
}

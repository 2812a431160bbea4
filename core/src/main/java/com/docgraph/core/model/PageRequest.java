package com.docgraph.core.model;

import java.util.Objects;

/** fetch 1회 요청. */
public record PageRequest(String url, ExtractMode mode) {
    public PageRequest {
        Objects.requireNonNull(url, "url");
        mode = (mode == null ? ExtractMode.DOCUMENT : mode);
    }

    public static PageRequest of(String url, ExtractMode mode) {
        return new PageRequest(url, mode);
    }
}

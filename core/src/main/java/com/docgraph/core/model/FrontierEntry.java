package com.docgraph.core.model;

import java.util.Objects;

/** 큐 항목. offer 시 생성, dequeue 시 정확히 한 번 소비. */
public record FrontierEntry(String url, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }
}

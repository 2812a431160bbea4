package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 탐색 중 한 페이지의 실패. 탐색 자체는 계속된다. */
public record PageFailure(
        @JsonProperty("url") String url,
        @JsonProperty("depth") int depth,
        @JsonProperty("stage") String stage,
        @JsonProperty("error") String error
) {}

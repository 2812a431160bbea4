package com.docgraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 작업 전체가 실패했을 때의 위치 정보.
 * stage: "validate" | "fetch" | "traverse" | "store"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationError(
        @JsonProperty("stage") String stage,
        @JsonProperty("url") String url,
        @JsonProperty("message") String message
) {
    public static final String STAGE_VALIDATE = "validate";
    public static final String STAGE_FETCH = "fetch";
    public static final String STAGE_TRAVERSE = "traverse";
    public static final String STAGE_STORE = "store";

    public static OperationError of(String stage, String url, Throwable t) {
        String msg = (t == null) ? "unknown error"
                : (t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
        return new OperationError(stage, url, msg);
    }
}

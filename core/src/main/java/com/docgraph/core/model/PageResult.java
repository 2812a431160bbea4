package com.docgraph.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * fetch 1회의 결과. Fetch Client가 만들고 Graph Assembler / Link Filter가 한 번씩 소비한다.
 * 본문은 모드에 따라 다르다: DOCUMENT → text, STRUCTURED → structured, LINK_LIST → outboundLinks만 보장.
 */
public final class PageResult {
    private final String url;
    private final ExtractMode mode;
    private final String title;
    private final String text;                   // DOCUMENT 본문(마크다운)
    private final StructuredContent structured;  // STRUCTURED 필드(없으면 null)
    private final List<String> outboundLinks;    // 절대 URL, 발견 순서 유지
    private final Map<String, String> metadata;
    private final boolean succeeded;
    private final String error;

    private PageResult(Builder b) {
        this.url = b.url;
        this.mode = (b.mode == null ? ExtractMode.DOCUMENT : b.mode);
        this.title = (b.title == null ? "" : b.title);
        this.text = b.text;
        this.structured = b.structured;
        this.outboundLinks = (b.outboundLinks == null) ? List.of() : List.copyOf(b.outboundLinks);
        this.metadata = (b.metadata == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.succeeded = b.succeeded;
        this.error = b.error;
    }

    public String getUrl() { return url; }
    public ExtractMode getMode() { return mode; }
    public String getTitle() { return title; }
    public String getText() { return text; }
    public StructuredContent getStructured() { return structured; }
    public List<String> getOutboundLinks() { return outboundLinks; }
    public Map<String, String> getMetadata() { return metadata; }
    public boolean isSucceeded() { return succeeded; }
    public Optional<String> getError() { return Optional.ofNullable(error); }

    /** 실패 결과. error가 비면 "unknown error". */
    public static PageResult failure(String url, ExtractMode mode, String error) {
        return builder()
                .url(url)
                .mode(mode)
                .succeeded(false)
                .error(error == null || error.isBlank() ? "unknown error" : error)
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .url(url).mode(mode).title(title).text(text).structured(structured)
                .outboundLinks(outboundLinks).metadata(metadata)
                .succeeded(succeeded).error(error);
    }

    @Override public String toString() {
        return "PageResult{" + url + ", " + mode + ", ok=" + succeeded
                + (error != null ? ", error=" + error : "")
                + ", links=" + outboundLinks.size() + "}";
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private ExtractMode mode;
        private String title;
        private String text;
        private StructuredContent structured;
        private List<String> outboundLinks;
        private Map<String, String> metadata;
        private boolean succeeded = true;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder mode(ExtractMode mode) { this.mode = mode; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder text(String text) { this.text = text; return this; }
        public Builder structured(StructuredContent structured) { this.structured = structured; return this; }
        public Builder outboundLinks(List<String> links) { this.outboundLinks = links; return this; }
        public Builder metadata(Map<String, String> metadata) { this.metadata = metadata; return this; }
        public Builder succeeded(boolean succeeded) { this.succeeded = succeeded; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public PageResult build() {
            Objects.requireNonNull(url, "url");
            return new PageResult(this);
        }
    }
}

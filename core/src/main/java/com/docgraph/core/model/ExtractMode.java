package com.docgraph.core.model;

import java.util.Locale;

/**
 * 단일 페이지 fetch 결과의 형태.
 * wire 이름("markdown" / "structured" / "links")은 외부 호출 계층과의 계약이다.
 */
public enum ExtractMode {
    DOCUMENT("markdown"),
    STRUCTURED("structured"),
    LINK_LIST("links");

    private final String wireName;

    ExtractMode(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    /** wire 이름 또는 enum 이름 → ExtractMode. 모르는 값/누락은 DOCUMENT. */
    public static ExtractMode fromWireName(String s) {
        if (s == null || s.isBlank()) return DOCUMENT;
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (ExtractMode m : values()) {
            if (m.wireName.equals(v) || m.name().toLowerCase(Locale.ROOT).equals(v)) return m;
        }
        return DOCUMENT;
    }
}

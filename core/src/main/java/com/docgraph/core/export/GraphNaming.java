package com.docgraph.core.export;

import java.util.Locale;

/** 프레임워크 이름 → 파일명 slug. 저장소와 내보내기가 같은 규칙을 쓴다. */
public final class GraphNaming {
    private GraphNaming() {}

    public static final String GRAPH_SUFFIX = "-graph.json";

    public static String slug(String framework) {
        if (framework == null || framework.isBlank()) return "unnamed";
        String s = framework.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9._-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^[-.]+|-+$", "");
        if (s.length() > 60) s = s.substring(0, 60);
        return s.isEmpty() ? "unnamed" : s;
    }

    public static String fileName(String framework) {
        return slug(framework) + GRAPH_SUFFIX;
    }
}

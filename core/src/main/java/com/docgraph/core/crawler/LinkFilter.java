package com.docgraph.core.crawler;

import com.docgraph.core.model.CrawlConfig;
import com.docgraph.core.util.UrlUtils;

import java.util.Collection;

/**
 * 발견된 링크의 탐색 자격 판정.
 * <ol>
 *   <li>범위: 정규화된 scheme+host+path 가 base와 같거나 base 경로를 '/' 경계에서 이어가야 함
 *       (query/fragment는 비교에서 무시)</li>
 *   <li>base 자신은 패턴과 무관하게 항상 허용</li>
 *   <li>패턴: 주어지면 그중 하나가 링크 문자열에 포함돼야 함. 비었으면
 *       {@link CrawlConfig#DEFAULT_PATTERNS} 적용</li>
 * </ol>
 * 상대 URL은 받지 않는다(Fetch Client가 절대 URL로 해석해서 넘겨야 함) → 항상 false.
 */
public final class LinkFilter {

    private final String baseUrl;
    private final String baseKey;
    private final Collection<String> patterns;

    public LinkFilter(String baseUrl, Collection<String> patterns) {
        this.baseUrl = baseUrl;
        this.baseKey = UrlUtils.scopeKey(baseUrl);
        this.patterns = (patterns == null || patterns.isEmpty()) ? CrawlConfig.DEFAULT_PATTERNS : patterns;
    }

    public boolean isEligible(String link) {
        if (baseKey == null) return false;
        String key = UrlUtils.scopeKey(link);
        if (key == null) return false;
        if (key.equals(baseKey)) return true;
        if (!key.startsWith(baseKey + "/")) return false;
        return matchesAny(link, patterns);
    }

    public String baseUrl() { return baseUrl; }

    /** 단발 판정용 */
    public static boolean isEligible(String link, String baseUrl, Collection<String> patterns) {
        return new LinkFilter(baseUrl, patterns).isEligible(link);
    }

    private static boolean matchesAny(String link, Collection<String> patterns) {
        for (String p : patterns) {
            if (p == null || p.isEmpty()) continue;
            if (link.contains(p)) return true;
        }
        return false;
    }
}

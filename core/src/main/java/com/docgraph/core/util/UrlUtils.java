package com.docgraph.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + 범위(prefix) 비교 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * - query는 유지
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        String query = u.getQuery();

        try {
            return new URI(scheme, null, host, port, path, query, null); // fragment 제거
        } catch (URISyntaxException e) {
            // 파싱 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /**
     * 문자열 버전. 파싱 불가/상대 URL이면 null.
     * 루트가 아닌 경로의 끝 슬래시는 보존한다(서버에 따라 다른 문서일 수 있음).
     */
    public static String normalize(String s) {
        URI u = parseAbsolute(s);
        return (u == null) ? null : normalize(u).toString();
    }

    /** http(s) 절대 URL만 URI로. 그 외는 null */
    public static URI parseAbsolute(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            URI u = new URI(s.trim());
            String scheme = u.getScheme();
            if (scheme == null || u.getHost() == null) return null;
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return null;
            return u;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * 범위 비교 키: scheme://host[:port]/path (query/fragment 무시, 끝 슬래시 제거).
     * 파싱 불가면 null.
     */
    public static String scopeKey(String s) {
        URI u = parseAbsolute(s);
        return (u == null) ? null : pathKey(normalize(u));
    }

    /**
     * 방문 키: 범위 키 + query. {@code /docs} 와 {@code /docs/} 는 같은 페이지로 본다.
     * LinkFilter의 base 판정과 같은 경로 규칙이라 둘이 URL 동일성에서 어긋나지 않는다.
     * 파싱 불가면 null.
     */
    public static String visitKey(String s) {
        URI u = parseAbsolute(s);
        if (u == null) return null;
        URI n = normalize(u);
        String q = n.getRawQuery();
        return (q == null) ? pathKey(n) : pathKey(n) + "?" + q;
    }

    private static String pathKey(URI n) {
        String path = n.getPath() == null ? "" : n.getPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        String authority = n.getHost() + (n.getPort() < 0 ? "" : ":" + n.getPort());
        return n.getScheme() + "://" + authority + path;
    }
}

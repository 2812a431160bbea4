package com.docgraph.core.fetch;

import com.docgraph.core.model.StructuredContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTML 문서에서 STRUCTURED 필드를 규칙 기반으로 뽑는다(LLM 없이).
 * - title: 본문 h1, 없으면 &lt;title&gt;
 * - concepts: 본문 h2/h3 제목
 * - api_surface: dl의 dt/dd 쌍 + 코드 시그니처처럼 보이는 제목(h2~h4 안의 code, 또는 "name(" 형태)
 * - code_samples: pre 블록
 * - dependencies: 설치 명령(pip/npm/yarn/go get/cargo add) 줄과 maven/gradle 좌표
 */
public final class StructuredExtractor {
    private StructuredExtractor() {}

    static final int MAX_SAMPLES = 20;
    static final int MAX_SAMPLE_CHARS = 4_000;

    private static final Pattern SIGNATURE = Pattern.compile("^[A-Za-z_$][\\w$.]*\\s*\\(.*\\)\\s*$");
    private static final Pattern INSTALL = Pattern.compile(
            "^(?:\\$\\s*)?(pip3? install|npm (?:install|i)|yarn add|pnpm add|go get|cargo add|gem install|composer require)\\s+(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MAVEN_COORD = Pattern.compile(
            "<groupId>\\s*([\\w.\\-]+)\\s*</groupId>\\s*<artifactId>\\s*([\\w.\\-]+)\\s*</artifactId>");
    private static final Pattern GRADLE_COORD = Pattern.compile(
            "(?:implementation|api|compile)\\s*\\(?\\s*['\"]([\\w.\\-]+:[\\w.\\-]+)(?::[\\w.\\-]+)?['\"]");

    public static StructuredContent extract(Document doc) {
        StructuredContent.Builder b = StructuredContent.builder();
        if (doc == null) return b.build();

        Element main = MarkdownRenderer.mainContent(doc);

        Element h1 = main.selectFirst("h1");
        String title = (h1 != null && !h1.text().isBlank()) ? h1.text().trim() : doc.title().trim();
        b.title(title);

        for (Element h : main.select("h2, h3")) {
            String t = h.text().trim();
            if (t.isEmpty()) continue;
            if (looksLikeSignature(h)) continue;
            b.concept(t);
        }

        // dl > dt/dd (Sphinx/Javadoc 스타일 API 목록)
        for (Element dt : main.select("dl > dt")) {
            String name = dt.text().trim();
            Element dd = dt.nextElementSibling();
            String desc = (dd != null && dd.normalName().equals("dd")) ? firstSentence(dd.text()) : "";
            b.api(name, desc);
        }
        // 시그니처 제목
        for (Element h : main.select("h2, h3, h4")) {
            if (!looksLikeSignature(h)) continue;
            Element next = h.nextElementSibling();
            String desc = (next != null && next.normalName().equals("p")) ? firstSentence(next.text()) : "";
            b.api(h.text().trim(), desc);
        }

        int n = 0;
        for (Element pre : main.select("pre")) {
            if (n >= MAX_SAMPLES) break;
            String code = pre.wholeText().strip();
            if (code.isEmpty()) continue;
            b.codeSample(code.length() > MAX_SAMPLE_CHARS ? code.substring(0, MAX_SAMPLE_CHARS) : code);
            n++;
            collectDependencies(code, b);
        }
        return b.build();
    }

    static boolean looksLikeSignature(Element heading) {
        Element code = heading.selectFirst("code");
        if (code != null && code.text().trim().length() >= heading.text().trim().length() / 2) return true;
        return SIGNATURE.matcher(heading.text().trim()).matches();
    }

    static void collectDependencies(String code, StructuredContent.Builder b) {
        for (String line : code.split("\\R")) {
            Matcher m = INSTALL.matcher(line.trim());
            if (!m.matches()) continue;
            for (String pkg : m.group(2).trim().split("\\s+")) {
                if (pkg.startsWith("-")) continue;
                b.dependency(pkg.replaceAll("[;&|]+$", ""));
            }
        }
        Matcher mv = MAVEN_COORD.matcher(code);
        while (mv.find()) b.dependency(mv.group(1) + ":" + mv.group(2));
        Matcher gr = GRADLE_COORD.matcher(code);
        while (gr.find()) b.dependency(gr.group(1));
    }

    private static String firstSentence(String s) {
        if (s == null) return "";
        String t = s.trim();
        int dot = t.indexOf(". ");
        return (dot > 0 ? t.substring(0, dot + 1) : t);
    }
}

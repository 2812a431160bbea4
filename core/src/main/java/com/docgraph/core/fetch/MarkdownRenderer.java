package com.docgraph.core.fetch;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Locale;
import java.util.Set;

/**
 * jsoup Document → 간단한 마크다운 텍스트.
 * 문서 사이트에서 흔한 요소(h1~h6, p, pre/code, ul/ol/li, blockquote, table 텍스트)만 다룬다.
 * nav/header/footer/script/style 등 탐색용 껍데기는 건너뛴다.
 */
final class MarkdownRenderer {
    private MarkdownRenderer() {}

    private static final Set<String> SKIP =
            Set.of("script", "style", "noscript", "nav", "header", "footer", "aside", "svg", "form");

    static String render(Document doc) {
        if (doc == null) return "";
        Element root = mainContent(doc);
        StringBuilder sb = new StringBuilder(1024);
        for (Node n : root.childNodes()) block(n, sb, 0);
        return sb.toString().replaceAll("\n{3,}", "\n\n").trim();
    }

    /** main / article / [role=main] 우선, 없으면 body */
    static Element mainContent(Document doc) {
        Element m = doc.selectFirst("main, article, [role=main]");
        if (m != null) return m;
        return doc.body() != null ? doc.body() : doc;
    }

    private static void block(Node n, StringBuilder sb, int listDepth) {
        if (n instanceof TextNode t) {
            String s = t.text().trim();
            if (!s.isEmpty()) sb.append(s).append(' ');
            return;
        }
        if (!(n instanceof Element e)) return;

        String tag = e.normalName();
        if (SKIP.contains(tag)) return;
        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                int level = tag.charAt(1) - '0';
                sb.append("\n\n").append("#".repeat(level)).append(' ').append(e.text().trim()).append("\n\n");
            }
            case "p" -> sb.append("\n\n").append(inline(e)).append("\n\n");
            case "pre" -> {
                Element code = e.selectFirst("code");
                String lang = (code == null) ? "" : language(code);
                String body = (code == null ? e.wholeText() : code.wholeText());
                sb.append("\n\n```").append(lang).append('\n')
                  .append(body.stripTrailing()).append("\n```\n\n");
            }
            case "ul", "ol" -> {
                int i = 1;
                sb.append('\n');
                for (Element li : e.children()) {
                    if (!li.normalName().equals("li")) continue;
                    sb.append("  ".repeat(listDepth))
                      .append(tag.equals("ol") ? (i++) + ". " : "- ")
                      .append(inline(li))
                      .append('\n');
                    for (Element nested : li.children()) {
                        if (nested.normalName().equals("ul") || nested.normalName().equals("ol")) {
                            block(nested, sb, listDepth + 1);
                        }
                    }
                }
                sb.append('\n');
            }
            case "blockquote" -> sb.append("\n\n> ").append(inline(e)).append("\n\n");
            case "br" -> sb.append('\n');
            case "hr" -> sb.append("\n\n---\n\n");
            case "tr" -> {
                StringBuilder row = new StringBuilder("|");
                for (Element cell : e.select("> th, > td")) row.append(' ').append(cell.text().trim()).append(" |");
                sb.append(row).append('\n');
            }
            default -> {
                for (Node c : e.childNodes()) block(c, sb, listDepth);
            }
        }
    }

    /** 인라인 요소: code → `x`, a → [text](href), strong/em 유지 */
    private static String inline(Element e) {
        StringBuilder sb = new StringBuilder();
        for (Node n : e.childNodes()) {
            if (n instanceof TextNode t) {
                sb.append(t.text());
            } else if (n instanceof Element c) {
                switch (c.normalName()) {
                    case "code" -> sb.append('`').append(c.text()).append('`');
                    case "a" -> {
                        String href = c.attr("abs:href");
                        if (href.isBlank()) sb.append(c.text());
                        else sb.append('[').append(c.text()).append("](").append(href).append(')');
                    }
                    case "strong", "b" -> sb.append("**").append(c.text()).append("**");
                    case "em", "i" -> sb.append('_').append(c.text()).append('_');
                    case "br" -> sb.append('\n');
                    case "ul", "ol" -> { } // 중첩 목록은 block()에서 따로
                    default -> {
                        if (!SKIP.contains(c.normalName())) sb.append(inline(c));
                    }
                }
            }
        }
        return sb.toString().replaceAll("[ \\t]+", " ").trim();
    }

    /** class="language-java" / "lang-java" → "java" */
    static String language(Element code) {
        for (String cls : code.classNames()) {
            String c = cls.toLowerCase(Locale.ROOT);
            if (c.startsWith("language-")) return c.substring("language-".length());
            if (c.startsWith("lang-")) return c.substring("lang-".length());
        }
        return "";
    }
}

package com.example.slidetpl;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 幻灯片 XML 的模板预处理。PowerPoint 会把一段文字拆成多个 &lt;a:r&gt;，
 * 于是 {{、{% 这样的定界符被标签切断；这里在交给 Jinja 之前把它们拼回去。
 * 顺序：定界符重组 → 指令内 run 边界折叠 → xml:space 标记 → 前缀提升 → 实体还原。
 */
public final class XmlPreprocessor {
    private XmlPreprocessor() {}

    /** {{ … }} / {% … %} / {# … #}，非贪婪 */
    public static final Pattern DIRECTIVE = Pattern.compile("\\{\\{.*?\\}\\}|\\{%.*?%\\}|\\{#.*?#\\}", Pattern.DOTALL);

    private static final Pattern RUN_BOUNDARY = Pattern.compile("</a:t>.*?<a:t(?:\\s[^>]*)?>", Pattern.DOTALL);
    private static final Pattern TEXT_LEAF = Pattern.compile("(<a:t(?:\\s[^>]*)?>)(.*?)</a:t>", Pattern.DOTALL);
    private static final Pattern XML_SPACE = Pattern.compile("xml:space=\"[^\"]*\"");
    private static final String PRESERVE = "xml:space=\"preserve\"";

    // 两个定界字符之间只允许出现标签片段
    private static final Pattern[] SPLIT_PATTERNS = {
            Pattern.compile("\\{(?:<[^>]*>)*\\{"),
            Pattern.compile("\\}(?:<[^>]*>)*\\}"),
            Pattern.compile("\\{(?:<[^>]*>)*%"),
            Pattern.compile("%(?:<[^>]*>)*\\}"),
            Pattern.compile("\\{(?:<[^>]*>)*#"),
            Pattern.compile("#(?:<[^>]*>)*\\}"),
    };
    private static final String[] JOINED = { "{{", "}}", "{%", "%}", "{#", "#}" };

    public static String preprocess(String xml) {
        xml = reconstituteDelimiters(xml);
        xml = collapseDirectiveBoundaries(xml);
        xml = ensureSpacePreservation(xml);
        xml = elevateScopedDirectives(xml);
        xml = normalizeEntities(xml);
        return xml;
    }

    /** 例：{@code {</a:t></a:r><a:r><a:t>{} → {@code {{} */
    public static String reconstituteDelimiters(String xml) {
        for (int i = 0; i < SPLIT_PATTERNS.length; i++) {
            xml = SPLIT_PATTERNS[i].matcher(xml).replaceAll(Matcher.quoteReplacement(JOINED[i]));
        }
        return xml;
    }

    /** 指令内部的 &lt;/a:t&gt;…&lt;a:t&gt; 全部去掉，使整条指令落在同一个 &lt;a:t&gt; 里 */
    public static String collapseDirectiveBoundaries(String xml) {
        return mapDirectives(xml, d -> RUN_BOUNDARY.matcher(d).replaceAll(""));
    }

    /** 含指令的 &lt;a:t&gt; 加 xml:space="preserve"，否则渲染时首尾空白会被吃掉 */
    public static String ensureSpacePreservation(String xml) {
        Matcher m = TEXT_LEAF.matcher(xml);
        StringBuilder sb = new StringBuilder(xml.length() + 64);
        while (m.find()) {
            String open = m.group(1);
            String content = m.group(2);
            if (!open.contains(PRESERVE) && containsDirective(content)) {
                Matcher space = XML_SPACE.matcher(open);
                open = space.find() ? space.replaceFirst(PRESERVE) : "<a:t " + PRESERVE + open.substring(4);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(open + content + "</a:t>"));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String elevateScopedDirectives(String xml) {
        return TagElevator.elevate(xml);
    }

    /** 仅在指令内部还原实体与弯引号，指令外的转义保持不变 */
    public static String normalizeEntities(String xml) {
        return mapDirectives(xml, XmlPreprocessor::unescapeDirective);
    }

    static String unescapeDirective(String directive) {
        return directive
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&")
                .replace("&apos;", "'")
                .replace("&quot;", "\"")
                .replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'');
    }

    public static boolean containsDirective(String text) {
        return text != null && DIRECTIVE.matcher(text).find();
    }

    private static String mapDirectives(String xml, UnaryOperator<String> fn) {
        return DIRECTIVE.matcher(xml).replaceAll(r -> Matcher.quoteReplacement(fn.apply(r.group())));
    }
}

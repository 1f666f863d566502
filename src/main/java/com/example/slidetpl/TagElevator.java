package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 带作用域前缀的指令（{%pp …%}、{{tc …}} 等）提升到其外层结构元素。
 * 没有完整的 XML 解析树，外层元素靠双向的深度计数扫描定位：向后找未闭合的开标签，向前找与之配对的闭标签。
 */
@Slf4j
public final class TagElevator {
    private TagElevator() {}

    private static final Map<ScopePrefix, Pattern> PREFIXED = new EnumMap<>(ScopePrefix.class);
    static {
        for (ScopePrefix prefix : ScopePrefix.values()) {
            String p = Pattern.quote(prefix.token);
            PREFIXED.put(prefix, Pattern.compile(
                    "\\{%\\s*" + p + "\\s+(\\S.*?)\\s*%\\}|\\{\\{\\s*" + p + "\\s+(\\S.*?)\\s*\\}\\}",
                    Pattern.DOTALL));
        }
    }

    /** 按优先级依次处理所有前缀 */
    public static String elevate(String xml) {
        for (ScopePrefix prefix : ScopePrefix.values()) xml = elevate(xml, prefix);
        return xml;
    }

    public static String elevate(String xml, ScopePrefix prefix) {
        Pattern pattern = PREFIXED.get(prefix);
        Matcher m = pattern.matcher(xml);
        while (m.find()) {
            String bare = bareDirective(m);
            int open = findEnclosingOpen(xml, m.start(), prefix.elementTag);
            int end = open < 0 ? -1 : findEnclosingClose(xml, m.end(), prefix.elementTag);
            if (open < 0 || end < 0) {
                log.debug("no enclosing <{}> for {}, stripping prefix in place", prefix.elementTag, m.group());
                xml = xml.substring(0, m.start()) + bare + xml.substring(m.end());
            } else {
                xml = xml.substring(0, open) + bare + xml.substring(end);
            }
            m = pattern.matcher(xml);
        }
        return xml;
    }

    /** 只去掉前缀、不改动结构（变量发现用） */
    public static String stripPrefixes(String xml) {
        for (ScopePrefix prefix : ScopePrefix.values()) {
            xml = PREFIXED.get(prefix).matcher(xml).replaceAll(r -> Matcher.quoteReplacement(bareDirective(r)));
        }
        return xml;
    }

    private static String bareDirective(MatchResult m) {
        return m.group(1) != null ? "{% " + m.group(1) + " %}" : "{{ " + m.group(2) + " }}";
    }

    /**
     * 从 pos 向前扫描，返回包住 pos 的最内层 &lt;tag&gt; 开标签位置；遇到闭标签 depth+1，遇到开标签 depth-1。
     * @return 开标签起始下标，找不到为 -1
     */
    static int findEnclosingOpen(String xml, int pos, String tag) {
        String closeTag = "</" + tag + ">";
        int depth = 0;
        int searchPos = pos;
        while (searchPos > 0) {
            int open = lastOpenTag(xml, tag, searchPos);
            if (open < 0) return -1;
            int close = xml.lastIndexOf(closeTag, searchPos - 1);
            if (close > open) {
                depth++;
                searchPos = close;
            } else {
                if (depth == 0) return open;
                depth--;
                searchPos = open;
            }
        }
        return -1;
    }

    /**
     * 从 pos 向后扫描，返回与外层开标签配对的闭标签之后的位置。
     * @return 闭标签结束下标（不含），找不到为 -1
     */
    static int findEnclosingClose(String xml, int pos, String tag) {
        String closeTag = "</" + tag + ">";
        int depth = 0;
        int searchPos = pos;
        while (searchPos < xml.length()) {
            int close = xml.indexOf(closeTag, searchPos);
            if (close < 0) return -1;
            int open = nextOpenTag(xml, tag, searchPos);
            if (open >= 0 && open < close) {
                depth++;
                searchPos = open + 1;
            } else {
                if (depth == 0) return close + closeTag.length();
                depth--;
                searchPos = close + closeTag.length();
            }
        }
        return -1;
    }

    private static int lastOpenTag(String xml, String tag, int before) {
        int idx = xml.lastIndexOf("<" + tag, before - 1);
        while (idx >= 0) {
            if (isOpenTagAt(xml, idx, tag)) return idx;
            idx = idx == 0 ? -1 : xml.lastIndexOf("<" + tag, idx - 1);
        }
        return -1;
    }

    private static int nextOpenTag(String xml, String tag, int from) {
        int idx = xml.indexOf("<" + tag, from);
        while (idx >= 0) {
            if (isOpenTagAt(xml, idx, tag)) return idx;
            idx = xml.indexOf("<" + tag, idx + 1);
        }
        return -1;
    }

    // <a:p> / <a:p attr…> 算开标签；<a:pPr>、自闭合 <a:p/> 不算
    private static boolean isOpenTagAt(String xml, int idx, String tag) {
        int after = idx + 1 + tag.length();
        if (after >= xml.length()) return false;
        char c = xml.charAt(after);
        if (c != '>' && c != '/' && !Character.isWhitespace(c)) return false;
        int gt = xml.indexOf('>', after);
        return gt > 0 && xml.charAt(gt - 1) != '/';
    }
}

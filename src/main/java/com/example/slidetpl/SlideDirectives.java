package com.example.slidetpl;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 一张幻灯片上的 {%slide …%} 标记：至多一个 if、至多一个 for。
 * endif / endfor 只是闭合标记，可省略。
 */
@Getter
final class SlideDirectives {

    private static final Pattern MARKER = Pattern.compile("\\{%-?\\s*slide\\s+(.*?)\\s*-?%\\}", Pattern.DOTALL);
    private static final Pattern IF = Pattern.compile("if\\s+(\\S.*)", Pattern.DOTALL);
    private static final Pattern FOR = Pattern.compile("for\\s+(.+?)\\s+in\\s+(\\S.*)", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final SlideDirectives NONE = new SlideDirectives(null, Collections.emptyList(), null);

    /** if 的条件表达式，没有时为 null */
    private final String condition;
    private final List<String> loopNames;
    /** for 的可迭代表达式，没有时为 null */
    private final String loopExpression;

    private SlideDirectives(String condition, List<String> loopNames, String loopExpression) {
        this.condition = condition;
        this.loopNames = loopNames;
        this.loopExpression = loopExpression;
    }

    /**
     * xml 需已做过定界符重组和 run 边界折叠。
     * @throws DirectiveSyntaxException 未知的 slide 指令、for 头格式错误、重复的 if / for
     */
    static SlideDirectives parse(String xml, int slideNumber) {
        String condition = null;
        List<String> names = Collections.emptyList();
        String iterable = null;

        Matcher m = MARKER.matcher(xml);
        while (m.find()) {
            String body = XmlPreprocessor.unescapeDirective(m.group(1)).trim();
            Matcher ifm = IF.matcher(body);
            Matcher form = FOR.matcher(body);
            if (ifm.matches()) {
                if (condition != null) throw new DirectiveSyntaxException("more than one slide if", slideNumber, null);
                condition = ifm.group(1).trim();
            } else if (body.matches("(?s)for\\b.*")) {
                if (!form.matches()) throw new DirectiveSyntaxException("malformed slide for: '" + body + "'", slideNumber, null);
                if (iterable != null) throw new DirectiveSyntaxException("more than one slide for", slideNumber, null);
                names = parseNames(form.group(1), body, slideNumber);
                iterable = form.group(2).trim();
            } else if (!body.equals("endif") && !body.equals("endfor")) {
                throw new DirectiveSyntaxException("unknown slide directive: '" + body + "'", slideNumber, null);
            }
        }
        if (condition == null && iterable == null) return NONE;
        return new SlideDirectives(condition, names, iterable);
    }

    private static List<String> parseNames(String raw, String body, int slideNumber) {
        String s = raw.trim();
        if (s.startsWith("(") && s.endsWith(")")) s = s.substring(1, s.length() - 1);
        List<String> names = new ArrayList<>();
        for (String part : s.split(",")) {
            String name = part.trim();
            if (!NAME.matcher(name).matches()) {
                throw new DirectiveSyntaxException("malformed slide for: '" + body + "'", slideNumber, null);
            }
            names.add(name);
        }
        return Collections.unmodifiableList(names);
    }

    /** 去掉所有 {%slide …%} 标记，幻灯片其余内容不动 */
    static String strip(String xml) {
        return MARKER.matcher(xml).replaceAll("");
    }

    boolean isEmpty() {
        return condition == null && loopExpression == null;
    }

    boolean hasCondition() {
        return condition != null;
    }

    boolean hasLoop() {
        return loopExpression != null;
    }

    /** 条件和可迭代表达式，供变量发现使用 */
    List<String> expressions() {
        List<String> out = new ArrayList<>(2);
        if (condition != null) out.add(condition);
        if (loopExpression != null) out.add(loopExpression);
        return out;
    }

    @Override
    public String toString() {
        return "SlideDirectives{if=" + condition + ", for=" + loopNames + " in " + loopExpression + "}";
    }
}

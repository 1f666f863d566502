package com.example.slidetpl;

import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * 带格式的文字，渲染为若干 &lt;a:r&gt;。
 * 插入位置在某个 &lt;a:t&gt; 里，所以输出时先闭合当前 run，最后再重新打开一个。
 */
public class RichText {
    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-Fa-f]{6}");

    private final StringBuilder runs = new StringBuilder();

    public RichText() {}

    public RichText(String text) {
        add(text);
    }

    public RichText(String text, TextStyle style) {
        add(text, style);
    }

    public RichText add(String text) {
        return add(text, TextStyle.PLAIN);
    }

    public RichText add(String text, TextStyle style) {
        StringBuilder attrs = new StringBuilder();
        StringBuilder children = new StringBuilder();
        if (style.getBold() != null) attrs.append(" b=\"").append(style.getBold() ? 1 : 0).append('"');
        if (style.getItalic() != null) attrs.append(" i=\"").append(style.getItalic() ? 1 : 0).append('"');
        if (style.getUnderline() != null) attrs.append(" u=\"").append(style.getUnderline() ? "sng" : "none").append('"');
        // 百分之一磅
        if (style.getSize() != null) attrs.append(" sz=\"").append(Math.round(style.getSize() * 100)).append('"');
        if (style.getColor() != null) {
            children.append("<a:solidFill><a:srgbClr val=\"").append(normalizeColor(style.getColor())).append("\"/></a:solidFill>");
        }
        if (style.getFont() != null) {
            String face = escape(style.getFont());
            children.append("<a:latin typeface=\"").append(face).append("\"/>")
                    .append("<a:cs typeface=\"").append(face).append("\"/>");
        }

        runs.append("<a:r>");
        if (attrs.length() > 0 || children.length() > 0) {
            runs.append("<a:rPr").append(attrs).append('>').append(children).append("</a:rPr>");
        }
        runs.append("<a:t xml:space=\"preserve\">").append(escape(text)).append("</a:t></a:r>");
        return this;
    }

    /** 只含 run 本身 */
    public String getRuns() {
        return runs.toString();
    }

    @Override
    public String toString() {
        return "</a:t></a:r>" + runs + "<a:r><a:t>";
    }

    private static String normalizeColor(String color) {
        String hex = color.startsWith("#") ? color.substring(1) : color;
        if (!HEX_COLOR.matcher(hex).matches()) {
            throw new IllegalArgumentException("color must be RRGGBB: " + color);
        }
        return hex.toUpperCase();
    }

    static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text, "UTF-8");
    }
}

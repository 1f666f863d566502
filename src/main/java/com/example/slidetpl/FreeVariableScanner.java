package com.example.slidetpl;

import com.hubspot.jinjava.tree.ExpressionNode;
import com.hubspot.jinjava.tree.Node;
import com.hubspot.jinjava.tree.TagNode;
import com.hubspot.jinjava.tree.parse.ExpressionToken;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 在 Jinjava 语法树上找出模板引用但未在模板内声明的变量名。
 * 指令边界和标签名来自 Jinjava 的解析；单个表达式内部再切词：属性访问（a.b 的 b）、过滤器名、is 测试名、关键字都不算；
 * for / set / macro 的目标算声明。
 */
final class FreeVariableScanner {
    private FreeVariableScanner() {}

    private static final Pattern TOKEN = Pattern.compile(
            "\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'|[A-Za-z_][A-Za-z0-9_]*|\\d+(?:\\.\\d+)?|\\S");

    private static final Set<String> RESERVED = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "recursive",
            "true", "false", "none", "True", "False", "None",
            "loop", "range", "caller", "super", "namespace", "cycler", "joiner");

    // 这些标签后面不是表达式
    private static final Set<String> NON_EXPRESSION_TAGS = Set.of(
            "endfor", "endif", "else", "endmacro", "endset", "endfilter", "endcall", "endblock",
            "raw", "endraw", "block", "extends", "include", "import", "from", "filter");

    /** 遍历 Jinjava 解析出的语法树；注释已被 Jinjava 丢弃 */
    static Set<String> scan(Node root) {
        Set<String> referenced = new LinkedHashSet<>();
        Set<String> declared = new HashSet<>();
        visit(root, referenced, declared);
        referenced.removeAll(declared);
        return referenced;
    }

    private static void visit(Node node, Set<String> referenced, Set<String> declared) {
        if (node instanceof ExpressionNode) {
            String expr = ((ExpressionToken) node.getMaster()).getExpr();
            collectReferences(tokenize(trimWhitespaceControl(expr)), 0, referenced);
        } else if (node instanceof TagNode) {
            TagNode tag = (TagNode) node;
            // raw 块里的内容原样输出
            if ("raw".equals(tag.getName())) return;
            visitTag(tag.getName(), tokenize(trimWhitespaceControl(tag.getHelpers())), referenced, declared);
        }
        for (Node child : node.getChildren()) {
            visit(child, referenced, declared);
        }
    }

    private static void visitTag(String name, List<String> tokens, Set<String> referenced, Set<String> declared) {
        if (NON_EXPRESSION_TAGS.contains(name)) return;
        switch (name) {
            case "for": {
                int in = tokens.indexOf("in");
                if (in < 0) break;
                for (int i = 0; i < in; i++) if (isIdentifier(tokens.get(i))) declared.add(tokens.get(i));
                collectReferences(tokens, in + 1, referenced);
                break;
            }
            case "set": {
                int eq = tokens.indexOf("=");
                int end = eq < 0 ? tokens.size() : eq;
                for (int i = 0; i < end; i++) if (isIdentifier(tokens.get(i))) declared.add(tokens.get(i));
                if (eq >= 0) collectReferences(tokens, eq + 1, referenced);
                break;
            }
            case "macro":
                for (String t : tokens) if (isIdentifier(t)) declared.add(t);
                break;
            default:
                collectReferences(tokens, 0, referenced);
        }
    }

    private static void collectReferences(List<String> tokens, int from, Set<String> out) {
        for (int i = from; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (!isIdentifier(t) || RESERVED.contains(t)) continue;
            String prev = i > 0 ? tokens.get(i - 1) : "";
            if (prev.equals(".") || prev.equals("|") || prev.equals("is")) continue;
            if (prev.equals("not") && i > 1 && tokens.get(i - 2).equals("is")) continue;
            // 关键字参数 f(x=1)
            if (i + 1 < tokens.size() && tokens.get(i + 1).equals("=")
                    && (i + 2 >= tokens.size() || !tokens.get(i + 2).equals("="))) continue;
            out.add(t);
        }
    }

    private static List<String> tokenize(String body) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(body);
        while (m.find()) tokens.add(m.group());
        return tokens;
    }

    private static String trimWhitespaceControl(String body) {
        String t = body == null ? "" : body.trim();
        if (t.startsWith("-") || t.startsWith("+")) t = t.substring(1);
        if (t.endsWith("-") || t.endsWith("+")) t = t.substring(0, t.length() - 1);
        return t.trim();
    }

    private static boolean isIdentifier(String t) {
        return !t.isEmpty() && (Character.isLetter(t.charAt(0)) || t.charAt(0) == '_');
    }
}

package com.example.slidetpl;

import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.interpret.Context;
import com.hubspot.jinjava.interpret.InterpretException;
import com.hubspot.jinjava.interpret.JinjavaInterpreter;
import com.hubspot.jinjava.interpret.RenderResult;
import com.hubspot.jinjava.interpret.TemplateError;
import com.hubspot.jinjava.interpret.TemplateSyntaxException;
import com.hubspot.jinjava.tree.Node;
import com.hubspot.jinjava.util.ObjectTruthValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Jinja 求值器（Jinjava）：整页渲染、单个表达式求值、静态变量发现 */
@Slf4j
@Component
public class JinjaEvaluator {

    private final Jinjava jinjava;

    public JinjaEvaluator(Jinjava jinjava) {
        this.jinjava = jinjava;
    }

    public String render(String template, Map<String, ?> bindings) {
        RenderResult result = jinjava.renderForResult(template, bindings);
        List<TemplateError> fatal = fatalErrors(result.getErrors());
        if (!fatal.isEmpty()) throw toException(fatal);
        return result.getOutput();
    }

    /** 单个表达式求值；未定义的变量得到 null，语法错误抛 DirectiveSyntaxException */
    public Object evaluate(String expression, Map<String, ?> bindings) {
        JinjavaInterpreter interpreter = newInterpreter(bindings);
        JinjavaInterpreter.pushCurrent(interpreter);
        try {
            Object value = interpreter.resolveELExpression(expression, 1);
            List<TemplateError> fatal = fatalErrors(interpreter.getErrors());
            if (!fatal.isEmpty()) throw toException(fatal);
            return value;
        } catch (TemplateSyntaxException e) {
            throw new DirectiveSyntaxException("invalid expression '" + expression + "': " + e.getMessage(), null, e);
        } catch (InterpretException e) {
            throw new TemplateEvaluationException("cannot evaluate '" + expression + "': " + e.getMessage(), null, e);
        } finally {
            JinjavaInterpreter.popCurrent();
        }
    }

    /** Jinja 真值：false、None、0、""、空集合均为假 */
    public boolean isTruthy(Object value) {
        return ObjectTruthValue.evaluate(value);
    }

    /** 尽力而为：有语法错误的源直接跳过，返回空集合 */
    public Set<String> freeVariables(String template) {
        JinjavaInterpreter interpreter = newInterpreter(Collections.emptyMap());
        JinjavaInterpreter.pushCurrent(interpreter);
        Node root;
        try {
            root = interpreter.parse(template);
            if (!fatalErrors(interpreter.getErrors()).isEmpty()) {
                log.debug("skip variable discovery, template has syntax errors: {}", interpreter.getErrors());
                return Collections.emptySet();
            }
        } catch (InterpretException e) {
            log.debug("skip variable discovery: {}", e.getMessage());
            return Collections.emptySet();
        } finally {
            JinjavaInterpreter.popCurrent();
        }
        return FreeVariableScanner.scan(root);
    }

    private JinjavaInterpreter newInterpreter(Map<String, ?> bindings) {
        Context context = new Context(jinjava.getGlobalContext());
        context.putAll(bindings);
        return new JinjavaInterpreter(jinjava, context, jinjava.getGlobalConfig());
    }

    private static List<TemplateError> fatalErrors(List<TemplateError> errors) {
        return errors.stream()
                .filter(e -> e.getSeverity() == TemplateError.ErrorType.FATAL)
                .collect(Collectors.toList());
    }

    private static TemplateException toException(List<TemplateError> fatal) {
        String message = fatal.stream()
                .map(e -> "line " + e.getLineno() + ": " + e.getMessage())
                .collect(Collectors.joining("; "));
        boolean syntax = fatal.stream().anyMatch(e -> e.getReason() == TemplateError.ErrorReason.SYNTAX_ERROR);
        return syntax ? new DirectiveSyntaxException(message) : new TemplateEvaluationException(message);
    }
}

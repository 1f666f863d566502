package com.example.slidetpl;

/** 表达式求值失败，或循环的可迭代对象不存在 */
public class TemplateEvaluationException extends TemplateException {

    public TemplateEvaluationException(String message) {
        super(message);
    }

    public TemplateEvaluationException(String message, Integer slideNumber, Throwable cause) {
        super(message, slideNumber, cause);
    }
}

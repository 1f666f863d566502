package com.example.slidetpl;

/** 重组后的指令不符合模板语法，或幻灯片级指令写法不对 */
public class DirectiveSyntaxException extends TemplateException {

    public DirectiveSyntaxException(String message) {
        super(message);
    }

    public DirectiveSyntaxException(String message, Integer slideNumber, Throwable cause) {
        super(message, slideNumber, cause);
    }
}

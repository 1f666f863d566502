package com.example.slidetpl;

import lombok.Getter;

/** 模板处理异常的基类；slideNumber 从 1 开始，与具体幻灯片无关时为 null */
@Getter
public class TemplateException extends RuntimeException {

    private final Integer slideNumber;

    public TemplateException(String message) {
        this(message, null, null);
    }

    public TemplateException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TemplateException(String message, Integer slideNumber, Throwable cause) {
        super(slideNumber == null ? message : "Slide " + slideNumber + ": " + message, cause);
        this.slideNumber = slideNumber;
    }
}

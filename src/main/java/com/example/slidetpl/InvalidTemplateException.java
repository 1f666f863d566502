package com.example.slidetpl;

/** .pptx 无法打开或解析 */
public class InvalidTemplateException extends TemplateException {

    public InvalidTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}

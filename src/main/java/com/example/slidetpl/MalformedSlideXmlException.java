package com.example.slidetpl;

/** 渲染后的幻灯片 XML 不是良构的，不能写回 */
public class MalformedSlideXmlException extends TemplateException {

    public MalformedSlideXmlException(String message, Integer slideNumber, Throwable cause) {
        super(message, slideNumber, cause);
    }
}

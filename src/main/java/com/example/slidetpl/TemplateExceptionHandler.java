package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/** 模板异常 → HTTP 状态码 */
@Slf4j
@RestControllerAdvice
public class TemplateExceptionHandler {

    @ExceptionHandler(InvalidTemplateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTemplate(InvalidTemplateException ex) {
        log.warn("invalid template: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex, ex.getSlideNumber());
    }

    @ExceptionHandler({DirectiveSyntaxException.class, TemplateEvaluationException.class})
    public ResponseEntity<Map<String, Object>> handleTemplateError(TemplateException ex) {
        log.warn("template error: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex, ex.getSlideNumber());
    }

    @ExceptionHandler(MalformedSlideXmlException.class)
    public ResponseEntity<Map<String, Object>> handleMalformed(MalformedSlideXmlException ex) {
        log.error("rendered slide is not well-formed: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex, ex.getSlideNumber());
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("bad request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex, null);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, Exception ex, Integer slideNumber) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.value());
        details.put("error", status.getReasonPhrase());
        details.put("exception", ex.getClass().getSimpleName());
        details.put("message", ex.getMessage());
        if (slideNumber != null) details.put("slide", slideNumber);
        return ResponseEntity.status(status).body(details);
    }
}

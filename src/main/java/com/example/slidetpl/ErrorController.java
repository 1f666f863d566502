package com.example.slidetpl;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.HashMap;
import java.util.Map;

/** 未被 MVC 处理的错误（过滤器、容器层）统一输出 JSON */
@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleError(HttpServletRequest request) {
        Map<String, Object> errorDetails = new HashMap<>();

        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");
        int status = statusCode != null ? statusCode : 500;
        HttpStatus resolved = HttpStatus.resolve(status);

        errorDetails.put("status", status);
        errorDetails.put("error", resolved != null ? resolved.getReasonPhrase() : "Error");
        errorDetails.put("message", errorMessage != null && !errorMessage.isEmpty() ? errorMessage : "An unexpected error occurred");

        if (exception != null) {
            Throwable cause = exception;
            while (!(cause instanceof TemplateException) && cause.getCause() != null) cause = cause.getCause();
            errorDetails.put("exception", cause.getClass().getSimpleName());
            errorDetails.put("details", cause.getMessage());
            if (cause instanceof TemplateException && ((TemplateException) cause).getSlideNumber() != null) {
                errorDetails.put("slide", ((TemplateException) cause).getSlideNumber());
            }
            log.error("request failed: {}", errorDetails, exception);
        } else {
            log.warn("request failed: {}", errorDetails);
        }

        return ResponseEntity.status(status).body(errorDetails);
    }
}

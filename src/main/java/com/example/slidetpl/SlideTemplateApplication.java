package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class SlideTemplateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlideTemplateApplication.class, args);
        log.info("Slide template renderer started, POST a .pptx to /api/render");
    }
}

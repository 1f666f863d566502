package com.example.slidetpl;

import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api")
public class TemplateController {

    static final String PPTX_TYPE = "application/vnd.openxmlformats-officedocument.presentationml.presentation";

    private final SlideTemplateProcessor processor;

    public TemplateController(SlideTemplateProcessor processor) {
        this.processor = processor;
    }

    @GetMapping("/")
    public String home() {
        return "Slide template renderer is running";
    }

    // 渲染：file 为 .pptx 模板，context 为 JSON 对象
    @PostMapping("/render")
    public ResponseEntity<byte[]> render(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "context", required = false) String context
    ) throws IOException {
        String filename = checkPptx(file);
        Map<String, Object> ctx = parseContext(context);
        log.info("render: file={}, contextKeys={}", filename, ctx.keySet());

        try (XMLSlideShow ppt = processor.load(file.getInputStream())) {
            processor.render(ppt, ctx);
            byte[] body = processor.write(ppt);
            return ResponseEntity.ok()
                    .header("Content-Disposition", "attachment; filename=rendered.pptx")
                    .contentType(MediaType.parseMediaType(PPTX_TYPE))
                    .body(body);
        }
    }

    // 列出模板中引用但未声明的变量
    @PostMapping("/variables")
    public Set<String> variables(@RequestParam("file") MultipartFile file) throws IOException {
        String filename = checkPptx(file);
        try (XMLSlideShow ppt = processor.load(file.getInputStream())) {
            Set<String> names = processor.discoverFreeVariables(ppt);
            log.info("variables: file={}, found={}", filename, names.size());
            return names;
        }
    }

    private static String checkPptx(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (file.isEmpty() || filename == null || !filename.toLowerCase().endsWith(".pptx")) {
            throw new IllegalArgumentException("unsupported file: " + filename + " (expected a non-empty .pptx)");
        }
        return filename;
    }

    static Map<String, Object> parseContext(String context) {
        if (context == null || context.isBlank()) return Collections.emptyMap();
        try {
            JSONObject json = JSONObject.parseObject(context);
            return json == null ? Collections.emptyMap() : json;
        } catch (JSONException e) {
            throw new IllegalArgumentException("context must be a JSON object: " + e.getMessage(), e);
        }
    }
}

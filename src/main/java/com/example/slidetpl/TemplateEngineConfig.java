package com.example.slidetpl;

import com.hubspot.jinjava.Jinjava;
import com.hubspot.jinjava.JinjavaConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TemplateEngineConfig {

    // ===== 渲染限制（可用环境变量覆盖） =====
    private static final long MAX_OUTPUT_SIZE = getEnvLong("PPTXTPL_MAX_OUTPUT_SIZE", 0L); // 单张幻灯片输出字符上限，0 = 不限
    private static final int MAX_RENDER_DEPTH = getEnvInt("PPTXTPL_MAX_RENDER_DEPTH", 10);

    private static int getEnvInt(String k, int d){ try { return Integer.parseInt(System.getenv().getOrDefault(k, String.valueOf(d))); } catch(Exception e){ return d; } }
    private static long getEnvLong(String k, long d){ try { return Long.parseLong(System.getenv().getOrDefault(k, String.valueOf(d))); } catch(Exception e){ return d; } }

    @Bean
    public Jinjava jinjava() {
        log.info("jinjava: maxOutputSize={}, maxRenderDepth={}", MAX_OUTPUT_SIZE, MAX_RENDER_DEPTH);
        JinjavaConfig config = JinjavaConfig.newBuilder()
                .withMaxOutputSize(MAX_OUTPUT_SIZE)
                .withMaxRenderDepth(MAX_RENDER_DEPTH)
                .build();
        return new Jinjava(config);
    }
}

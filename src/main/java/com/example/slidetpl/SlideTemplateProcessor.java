package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.xmlbeans.XmlException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 整个演示文稿的渲染入口：幻灯片级展开 → 每页预处理 → Jinja 渲染 → 写回。
 * 任何一页失败都中止整个文稿。
 */
@Slf4j
@Component
public class SlideTemplateProcessor {

    private static final Pattern TEXT_LEAF = Pattern.compile("(<a:t(?:\\s[^>]*)?>)(.*?)</a:t>", Pattern.DOTALL);
    private static final String LINE_BREAK = "</a:t></a:r><a:br/><a:r><a:t>";

    private final SlideExpander expander;
    private final JinjaEvaluator evaluator;

    public SlideTemplateProcessor(SlideExpander expander, JinjaEvaluator evaluator) {
        this.expander = expander;
        this.evaluator = evaluator;
    }

    public XMLSlideShow load(InputStream in) {
        try {
            return new XMLSlideShow(in);
        } catch (IOException | RuntimeException e) {
            throw new InvalidTemplateException("cannot open presentation: " + e.getMessage(), e);
        }
    }

    public byte[] write(XMLSlideShow ppt) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ppt.write(out);
        return out.toByteArray();
    }

    public void render(XMLSlideShow ppt, Map<String, ?> context) {
        long t0 = System.currentTimeMillis();
        Map<String, Object> ambient = RenderContext.escape(context);
        Map<Integer, Map<String, Object>> overrides = expander.expandStructure(ppt, ambient);

        List<XSLFSlide> slides = ppt.getSlides();
        int rendered = 0;
        for (int i = 0; i < slides.size(); i++) {
            XSLFSlide slide = slides.get(i);
            int slideNumber = i + 1;
            String xml = XmlPreprocessor.preprocess(SlideXml.serialize(slide));
            if (!XmlPreprocessor.containsDirective(xml)) {
                log.debug("slide {}: no directives, skipped", slideNumber);
                continue;
            }

            Map<String, Object> bindings = ambient;
            Map<String, Object> own = overrides.get(i);
            if (own != null) {
                bindings = new LinkedHashMap<>(ambient);
                bindings.putAll(own);
            }

            String output = renderSlide(xml, bindings, slideNumber);
            output = replaceNewlines(output);
            try {
                SlideXml.replace(slide, output);
            } catch (XmlException e) {
                throw new MalformedSlideXmlException("rendered xml is not well-formed: " + e.getMessage(), slideNumber, e);
            }
            rendered++;
        }
        log.info("rendered {} of {} slide(s) in {} ms", rendered, slides.size(), System.currentTimeMillis() - t0);
    }

    private String renderSlide(String xml, Map<String, Object> bindings, int slideNumber) {
        try {
            return evaluator.render(xml, bindings);
        } catch (DirectiveSyntaxException e) {
            throw new DirectiveSyntaxException(e.getMessage(), slideNumber, e);
        } catch (TemplateEvaluationException e) {
            throw new TemplateEvaluationException(e.getMessage(), slideNumber, e);
        }
    }

    /** &lt;a:t&gt; 里的 \n 变成 &lt;a:br/&gt;，前后各自成一个 run */
    static String replaceNewlines(String xml) {
        Matcher m = TEXT_LEAF.matcher(xml);
        StringBuilder sb = new StringBuilder(xml.length());
        while (m.find()) {
            String content = m.group(2);
            String leaf = content.indexOf('\n') < 0
                    ? m.group()
                    : m.group(1) + content.replace("\n", LINE_BREAK) + "</a:t>";
            m.appendReplacement(sb, Matcher.quoteReplacement(leaf));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * 模板引用但未声明的变量名，按字母排序。
     * 幻灯片循环绑定的名字也可能出现在结果里。
     */
    public Set<String> discoverFreeVariables(XMLSlideShow ppt) {
        Set<String> names = new TreeSet<>();
        List<XSLFSlide> slides = ppt.getSlides();
        for (int i = 0; i < slides.size(); i++) {
            String xml = SlideXml.serialize(slides.get(i));
            xml = XmlPreprocessor.reconstituteDelimiters(xml);
            xml = XmlPreprocessor.collapseDirectiveBoundaries(xml);
            xml = XmlPreprocessor.ensureSpacePreservation(xml);
            try {
                for (String expression : SlideDirectives.parse(xml, i + 1).expressions()) {
                    names.addAll(evaluator.freeVariables("{{ " + expression + " }}"));
                }
            } catch (DirectiveSyntaxException e) {
                log.debug("slide {}: {}", i + 1, e.getMessage());
            }
            xml = SlideDirectives.strip(xml);
            xml = TagElevator.stripPrefixes(xml);
            xml = XmlPreprocessor.normalizeEntities(xml);
            names.addAll(evaluator.freeVariables(xml));
        }
        return names;
    }
}

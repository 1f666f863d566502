package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.xmlbeans.XmlException;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 处理 {%slide if%} / {%slide for%}：条件为假删除幻灯片，循环按元素复制幻灯片。
 * 先收集再从右往左处理，位置每次按对象身份重新查找。
 */
@Slf4j
@Component
public class SlideExpander {

    private final JinjaEvaluator evaluator;

    public SlideExpander(JinjaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @return 最终幻灯片下标（0 起）→ 该页私有的变量；没有私有变量的页不出现
     */
    public Map<Integer, Map<String, Object>> expandStructure(XMLSlideShow ppt, Map<String, ?> context) {
        List<Work> work = new ArrayList<>();
        List<XSLFSlide> slides = ppt.getSlides();
        for (int i = 0; i < slides.size(); i++) {
            XSLFSlide slide = slides.get(i);
            String xml = XmlPreprocessor.collapseDirectiveBoundaries(
                    XmlPreprocessor.reconstituteDelimiters(SlideXml.serialize(slide)));
            SlideDirectives directives = SlideDirectives.parse(xml, i + 1);
            if (!directives.isEmpty()) work.add(new Work(slide, i + 1, directives, xml));
        }
        if (work.isEmpty()) return new TreeMap<>();
        log.info("expanding {} slide(s) with slide directives", work.size());

        Map<XSLFSlide, Map<String, Object>> overrides = new IdentityHashMap<>();
        for (int w = work.size() - 1; w >= 0; w--) {
            Work item = work.get(w);
            SlideDirectives d = item.directives;

            if (d.hasCondition()) {
                Object value = evaluate(d.getCondition(), context, item.slideNumber);
                if (!evaluator.isTruthy(value)) {
                    log.debug("slide {}: condition '{}' is false, removing", item.slideNumber, d.getCondition());
                    ppt.removeSlide(indexOf(ppt, item.slide));
                    continue;
                }
            }

            replace(item.slide, SlideDirectives.strip(item.xml), item.slideNumber);
            if (!d.hasLoop()) continue;

            List<Object> items = toItems(evaluate(d.getLoopExpression(), context, item.slideNumber),
                    d.getLoopExpression(), item.slideNumber);
            for (int k = 0; k < items.size(); k++) {
                XSLFSlide clone = SlideCloner.cloneSlide(ppt, item.slide);
                ppt.setSlideOrder(clone, indexOf(ppt, item.slide));
                Map<String, Object> own = bind(d.getLoopNames(), items.get(k), item.slideNumber);
                own.put("loop", LoopState.of(k, items.size()));
                overrides.put(clone, own);
            }
            ppt.removeSlide(indexOf(ppt, item.slide));
            log.debug("slide {}: expanded into {} slide(s)", item.slideNumber, items.size());
        }

        Map<Integer, Map<String, Object>> result = new TreeMap<>();
        List<XSLFSlide> finalSlides = ppt.getSlides();
        for (int i = 0; i < finalSlides.size(); i++) {
            Map<String, Object> own = overrides.get(finalSlides.get(i));
            if (own != null) result.put(i, own);
        }
        return result;
    }

    private Object evaluate(String expression, Map<String, ?> context, int slideNumber) {
        try {
            return evaluator.evaluate(expression, context);
        } catch (DirectiveSyntaxException e) {
            throw new DirectiveSyntaxException(e.getMessage(), slideNumber, e);
        } catch (TemplateEvaluationException e) {
            throw new TemplateEvaluationException(e.getMessage(), slideNumber, e);
        }
    }

    private static List<Object> toItems(Object value, String expression, int slideNumber) {
        if (value == null) {
            throw new TemplateEvaluationException("loop iterable '" + expression + "' is undefined", slideNumber, null);
        }
        List<Object> items = new ArrayList<>();
        if (value instanceof Map) {
            items.addAll(((Map<?, ?>) value).keySet());
        } else if (value instanceof Iterable) {
            for (Object o : (Iterable<?>) value) items.add(o);
        } else if (value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) items.add(Array.get(value, i));
        } else {
            throw new TemplateEvaluationException("loop iterable '" + expression + "' is not iterable: "
                    + value.getClass().getSimpleName(), slideNumber, null);
        }
        return items;
    }

    private static Map<String, Object> bind(List<String> names, Object item, int slideNumber) {
        Map<String, Object> own = new LinkedHashMap<>();
        if (names.size() == 1) {
            own.put(names.get(0), item);
            return own;
        }
        List<Object> parts = new ArrayList<>();
        if (item instanceof Map.Entry) {
            parts.add(((Map.Entry<?, ?>) item).getKey());
            parts.add(((Map.Entry<?, ?>) item).getValue());
        } else if (item instanceof List) {
            parts.addAll((List<?>) item);
        } else if (item != null && item.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(item); i++) parts.add(Array.get(item, i));
        } else {
            throw new TemplateEvaluationException("cannot unpack " + item + " into " + names, slideNumber, null);
        }
        if (parts.size() != names.size()) {
            throw new TemplateEvaluationException("cannot unpack " + parts.size() + " values into " + names, slideNumber, null);
        }
        for (int i = 0; i < names.size(); i++) own.put(names.get(i), parts.get(i));
        return own;
    }

    private static void replace(XSLFSlide slide, String xml, int slideNumber) {
        try {
            SlideXml.replace(slide, xml);
        } catch (XmlException e) {
            throw new MalformedSlideXmlException("slide xml is not well-formed after removing slide directives", slideNumber, e);
        }
    }

    private static int indexOf(XMLSlideShow ppt, XSLFSlide slide) {
        List<XSLFSlide> slides = ppt.getSlides();
        for (int i = 0; i < slides.size(); i++) {
            if (slides.get(i) == slide) return i;
        }
        throw new IllegalStateException("slide no longer in presentation: " + slide.getPackagePart().getPartName());
    }

    private static final class Work {
        final XSLFSlide slide;
        final int slideNumber;
        final SlideDirectives directives;
        final String xml;

        Work(XSLFSlide slide, int slideNumber, SlideDirectives directives, String xml) {
            this.slide = slide;
            this.slideNumber = slideNumber;
            this.xml = xml;
            this.directives = directives;
        }
    }
}

package com.example.slidetpl;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 渲染前的上下文转换：字符串做 XML 转义（递归进入 Map / List / 数组），
 * RichText、Listing 自己已经转义过，保持原样。
 */
final class RenderContext {
    private RenderContext() {}

    static Map<String, Object> escape(Map<String, ?> context) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (context == null) return out;
        context.forEach((k, v) -> out.put(k, escapeValue(v)));
        return out;
    }

    private static Object escapeValue(Object value) {
        if (value instanceof String) return RichText.escape((String) value);
        if (value instanceof RichText || value instanceof Listing) return value;
        if (value instanceof Map) {
            Map<Object, Object> m = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> m.put(k, escapeValue(v)));
            return m;
        }
        if (value instanceof Iterable) {
            List<Object> l = new ArrayList<>();
            for (Object o : (Iterable<?>) value) l.add(escapeValue(o));
            return l;
        }
        if (value != null && value.getClass().isArray() && !value.getClass().getComponentType().isPrimitive()) {
            List<Object> l = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) l.add(escapeValue(Array.get(value, i)));
            return l;
        }
        return value;
    }
}

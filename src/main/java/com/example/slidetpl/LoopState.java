package com.example.slidetpl;

import java.util.LinkedHashMap;
import java.util.Map;

/** 幻灯片循环里的 loop 变量；index 从 1 开始，index0 从 0 开始 */
final class LoopState {
    private LoopState() {}

    static Map<String, Object> of(int index0, int length) {
        Map<String, Object> loop = new LinkedHashMap<>();
        loop.put("index", index0 + 1);
        loop.put("index0", index0);
        loop.put("first", index0 == 0);
        loop.put("last", index0 == length - 1);
        loop.put("length", length);
        loop.put("revindex", length - index0);
        loop.put("revindex0", length - index0 - 1);
        return loop;
    }
}

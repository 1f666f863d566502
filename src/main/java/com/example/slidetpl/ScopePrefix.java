package com.example.slidetpl;

/** 指令作用域前缀 → 提升到的结构元素；枚举顺序即处理优先级 */
public enum ScopePrefix {
    PARAGRAPH("pp", "a:p"),
    SHAPE("sp", "p:sp"),
    ROW("tr", "a:tr"),
    CELL("tc", "a:tc");

    public final String token;
    public final String elementTag;

    ScopePrefix(String token, String elementTag) {
        this.token = token;
        this.elementTag = elementTag;
    }
}

package com.example.slidetpl;

import lombok.Builder;
import lombok.Getter;

/** RichText 一段文字的格式；为 null 的项不写，沿用版式里的格式 */
@Getter
@Builder
public class TextStyle {
    public static final TextStyle PLAIN = TextStyle.builder().build();

    private final Boolean bold;
    private final Boolean italic;
    private final Boolean underline;
    /** RRGGBB，可带 # */
    private final String color;
    /** 磅 */
    private final Double size;
    private final String font;
}

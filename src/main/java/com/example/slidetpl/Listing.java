package com.example.slidetpl;

/** 多行文字：转义后原样插入，其中的换行在渲染后变成 &lt;a:br/&gt; */
public class Listing {
    private final String text;

    public Listing(String text) {
        this.text = text == null ? "" : text;
    }

    @Override
    public String toString() {
        return RichText.escape(text);
    }
}

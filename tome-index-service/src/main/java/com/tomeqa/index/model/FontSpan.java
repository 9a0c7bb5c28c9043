package com.tomeqa.index.model;

/**
 * One run of text in a single font style, as reported by the PDF parser.
 */
public record FontSpan(String font, double size, int flags, String text) {

    public static final int BOLD_FLAG = 16;

    public FontSpan {
        font = font == null ? "unknown" : font;
        text = text == null ? "" : text;
    }

    public boolean isBold() {
        return (flags & BOLD_FLAG) != 0;
    }
}

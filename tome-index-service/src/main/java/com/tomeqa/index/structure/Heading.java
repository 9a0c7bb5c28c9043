package com.tomeqa.index.structure;

public record Heading(int level, String text, int page, double fontSize, boolean bold) {
}

package com.tomeqa.index.model;

import java.util.List;
import java.util.stream.Collectors;

public record TextLine(List<FontSpan> spans) {

    public TextLine {
        spans = spans == null ? List.of() : List.copyOf(spans);
    }

    public String text() {
        return spans.stream().map(FontSpan::text).collect(Collectors.joining());
    }
}

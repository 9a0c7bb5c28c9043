package com.tomeqa.index.model;

import java.util.List;

/**
 * A layout block of a page: lines of spans, in reading order.
 */
public record TextBlock(List<TextLine> lines) {

    public TextBlock {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}

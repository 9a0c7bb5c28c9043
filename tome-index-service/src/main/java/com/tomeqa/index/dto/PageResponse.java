package com.tomeqa.index.dto;

import com.tomeqa.index.model.PageDetails;

import java.util.Map;

public record PageResponse(
        String source,
        int page,
        String text,
        Map<String, Object> metadata,
        String imageUrl,
        Integer totalPages
) {
    public static PageResponse from(String source, int page, PageDetails details) {
        return new PageResponse(source, page, details.text(), details.metadata(), details.imageUrl(),
                details.totalPages());
    }
}

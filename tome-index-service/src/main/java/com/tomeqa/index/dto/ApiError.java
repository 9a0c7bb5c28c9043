package com.tomeqa.index.dto;

import java.time.Instant;
import java.util.Map;

public record ApiError(
        String errorId,
        String code,
        String message,
        String path,
        Instant timestamp,
        Map<String, Object> details
) {
    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String REBUILD_CONFLICT = "REBUILD_CONFLICT";
    public static final String INDEX_ERROR = "INDEX_ERROR";
    public static final String UNAVAILABLE = "UNAVAILABLE";
}

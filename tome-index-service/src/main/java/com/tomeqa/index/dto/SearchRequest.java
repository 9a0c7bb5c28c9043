package com.tomeqa.index.dto;

public record SearchRequest(
        String query,
        Integer limit,
        String collection
) {
    private static final int DEFAULT_LIMIT = 5;
    static final int MAX_LIMIT = 50;

    public void validate() {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        if (limit != null && (limit <= 0 || limit > MAX_LIMIT)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    public int getLimitOrDefault() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }
}

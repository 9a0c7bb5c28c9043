package com.tomeqa.index.dto;

import java.util.List;

public record SearchResponse(String query, String collection, List<SearchHit> results) {
}

package com.tomeqa.index.dto;

import com.tomeqa.index.model.ScoredChunk;

import java.util.Map;

public record SearchHit(String text, Map<String, Object> metadata, double score) {

    public static SearchHit from(ScoredChunk scored) {
        return new SearchHit(scored.chunk().text(), scored.chunk().metadata(), scored.score());
    }
}

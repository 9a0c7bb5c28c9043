package com.tomeqa.index.model;

public record ScoredChunk(Chunk chunk, double score) {
}

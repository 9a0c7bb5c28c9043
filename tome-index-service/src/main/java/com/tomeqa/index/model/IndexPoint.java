package com.tomeqa.index.model;

/**
 * An embedded chunk as stored in one collection generation.
 */
public record IndexPoint(long id, float[] vector, Chunk payload) {
}

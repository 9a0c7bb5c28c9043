package com.tomeqa.index.model;

import java.util.Map;

/**
 * All indexed text of one source page, stitched back together in chunk order.
 */
public record PageDetails(String text, Map<String, Object> metadata, String imageUrl, Integer totalPages) {
}

package com.tomeqa.index.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Hierarchical position of a piece of text: the heading path plus the text of each
 * heading level currently open.
 */
public record HeadingContext(List<String> headingPath, String section, String subsection, Map<Integer, String> levels) {

    public static final HeadingContext EMPTY = new HeadingContext(List.of(), null, null, Map.of());

    public HeadingContext {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
        levels = levels == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(levels));
    }

    public Optional<String> level(int level) {
        return Optional.ofNullable(levels.get(level));
    }

    public boolean isEmpty() {
        return headingPath.isEmpty();
    }

    /**
     * Writes section, subsection, heading_path and h1..h6 into chunk metadata. Absent values are not written.
     */
    public void writeTo(Map<String, Object> metadata) {
        if (section != null) metadata.put(MetadataKeys.SECTION, section);
        if (subsection != null) metadata.put(MetadataKeys.SUBSECTION, subsection);
        if (!headingPath.isEmpty()) {
            metadata.put(MetadataKeys.HEADING_PATH, String.join(MetadataKeys.HEADING_PATH_SEPARATOR, headingPath));
        }
        levels.forEach((level, text) -> metadata.put(MetadataKeys.headingKey(level), text));
    }

    public static HeadingContext fromMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return EMPTY;
        }
        Map<Integer, String> levels = new TreeMap<>();
        for (int level = 1; level <= 6; level++) {
            Object value = metadata.get(MetadataKeys.headingKey(level));
            if (value != null) levels.put(level, value.toString());
        }
        Object path = metadata.get(MetadataKeys.HEADING_PATH);
        List<String> headingPath = path == null || path.toString().isBlank()
                ? List.of()
                : Arrays.asList(path.toString().split(MetadataKeys.HEADING_PATH_SEPARATOR));
        Object section = metadata.get(MetadataKeys.SECTION);
        Object subsection = metadata.get(MetadataKeys.SUBSECTION);
        return new HeadingContext(
                headingPath,
                section != null ? section.toString() : null,
                subsection != null ? subsection.toString() : null,
                levels);
    }
}

package com.adlanda.transcriptsearch.model;

import java.util.Map;
import java.util.Objects;

/**
 * A short, time-ordered piece of transcript text belonging to one group (typically one video).
 *
 * @param id        Unique identifier of the segment
 * @param groupKey  Identifier of the parent group; segments of one group are contiguous
 * @param text      The transcribed text
 * @param start     Start offset in seconds
 * @param end       End offset in seconds
 * @param metadata  Passthrough fields (title, url, published, ...) carried onto chunks
 */
public record Segment(
        String id,
        String groupKey,
        String text,
        double start,
        double end,
        Map<String, Object> metadata
) {
    public Segment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(text, "text");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a segment without passthrough metadata.
     */
    public static Segment of(String id, String groupKey, String text, double start, double end) {
        return new Segment(id, groupKey, text, start, end, Map.of());
    }
}

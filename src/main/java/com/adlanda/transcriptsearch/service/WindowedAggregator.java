package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.exception.IngestionConfigurationException;
import com.adlanda.transcriptsearch.model.Chunk;
import com.adlanda.transcriptsearch.model.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Merges short transcript segments into overlapping windows suitable for embedding.
 *
 * A window starts at every multiple of {@code stride} and covers up to {@code window}
 * consecutive segments. Windows whose first and last segment belong to different
 * groups are dropped entirely rather than truncated at the group boundary.
 */
public class WindowedAggregator {

    private static final Logger log = LoggerFactory.getLogger(WindowedAggregator.class);

    private final int window;
    private final int stride;

    /**
     * @param window Number of consecutive segments merged into one chunk
     * @param stride Distance between the first segments of two consecutive windows
     * @throws IngestionConfigurationException if either value is not positive
     */
    public WindowedAggregator(int window, int stride) {
        if (window <= 0) {
            throw new IngestionConfigurationException("window must be positive, was " + window);
        }
        if (stride <= 0) {
            throw new IngestionConfigurationException("stride must be positive, was " + stride);
        }
        this.window = window;
        this.stride = stride;
    }

    /**
     * Lazily produces the chunks for the given segments.
     *
     * The returned stream can be consumed once; call again with the same list to
     * get an identical sequence.
     *
     * @param segments Segments ordered by group, then by time
     * @return chunks in start-position order
     */
    public Stream<Chunk> aggregate(List<Segment> segments) {
        int n = segments.size();
        return IntStream.iterate(0, i -> i < n, i -> stride >= n - i ? n : i + stride)
                .mapToObj(i -> windowAt(segments, i))
                .flatMap(Optional::stream);
    }

    /**
     * Convenience for callers that need the whole sequence in memory.
     */
    public List<Chunk> aggregateAll(List<Segment> segments) {
        List<Chunk> chunks = aggregate(segments).toList();
        log.info("Aggregated {} segments into {} chunks (window={}, stride={})",
                segments.size(), chunks.size(), window, stride);
        return chunks;
    }

    public int getWindow() {
        return window;
    }

    public int getStride() {
        return stride;
    }

    private Optional<Chunk> windowAt(List<Segment> segments, int i) {
        int last = (int) Math.min(segments.size() - 1L, (long) i + window - 1);
        Segment first = segments.get(i);
        Segment end = segments.get(last);

        if (!Objects.equals(first.groupKey(), end.groupKey())) {
            log.debug("Dropping window at {}: crosses from group '{}' into '{}'",
                    i, first.groupKey(), end.groupKey());
            return Optional.empty();
        }

        String text = segments.subList(i, last + 1).stream()
                .map(Segment::text)
                .collect(Collectors.joining(" "));

        return Optional.of(new Chunk(
                first.id(),
                first.groupKey(),
                text,
                first.start(),
                end.end(),
                first.metadata()
        ));
    }
}

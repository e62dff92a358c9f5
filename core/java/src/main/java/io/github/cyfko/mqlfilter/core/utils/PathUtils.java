package io.github.cyfko.mqlfilter.core.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers for dotted field paths such as {@code "tracks.0.playlists.name"}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PathUtils {

    /** Separator between path segments. */
    public static final String SEPARATOR = ".";

    private PathUtils() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Splits a dotted path into its segments. Empty segments are preserved, so
     * {@code "a..b"} yields {@code ["a", "", "b"]}; the empty path yields no segment.
     *
     * @param path dotted path
     * @return its segments
     */
    public static List<String> split(String path) {
        if (path == null || path.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(path.split("\\.", -1));
    }

    /**
     * Joins segments with {@value #SEPARATOR}.
     *
     * @param segments path segments
     * @return the dotted path
     */
    public static String join(List<String> segments) {
        return String.join(SEPARATOR, segments);
    }

    /**
     * @param segment a path segment
     * @return {@code true} if the segment starts with a digit, e.g. {@code "0"}
     */
    public static boolean isIndexSegment(String segment) {
        return segment != null && !segment.isEmpty() && Character.isDigit(segment.charAt(0));
    }

    /**
     * Removes index segments from a dotted path.
     * <pre>{@code
     * stripIndexSegments("tracks.0.playlists.name") // "tracks.playlists.name"
     * }</pre>
     *
     * @param path dotted path
     * @return the path without index segments
     */
    public static String stripIndexSegments(String path) {
        return split(path).stream()
                .filter(segment -> !isIndexSegment(segment))
                .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Returns the trailing {@code count} segments of a dotted path, or the whole path if it is shorter.
     *
     * @param path  dotted path
     * @param count number of trailing segments to keep
     * @return the trailing segments
     */
    public static List<String> tail(String path, int count) {
        List<String> segments = split(path);
        return new ArrayList<>(segments.subList(Math.max(0, segments.size() - count), segments.size()));
    }
}

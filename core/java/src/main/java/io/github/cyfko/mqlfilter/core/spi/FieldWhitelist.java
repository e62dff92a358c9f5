package io.github.cyfko.mqlfilter.core.spi;

import io.github.cyfko.mqlfilter.core.utils.PathUtils;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Policy deciding which dotted field paths a filter document may reference.
 * <p>
 * The compiler calls {@link #isAllowed(String)} for every plain field key it
 * meets, with the <em>internal</em> (post key-translation) full path from the
 * root model, index segments removed. For an {@code Album} root, a filter on
 * {@code tracks.0.playlists.name} is checked as {@code "tracks.playlists.name"}.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * FieldWhitelist open = FieldWhitelist.allowAll();
 * FieldWhitelist listed = FieldWhitelist.of(List.of("title", "tracks.name"));
 * FieldWhitelist custom = path -> !path.startsWith("customer.");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface FieldWhitelist {

    /**
     * @param path internal, index-stripped dotted path relative to the root model
     * @return {@code true} if the path may be filtered on
     */
    boolean isAllowed(String path);

    /**
     * Whitelist admitting every path. Unresolvable paths are still rejected later by the compiler.
     *
     * @return the permissive whitelist
     */
    static FieldWhitelist allowAll() {
        return path -> true;
    }

    /**
     * Whitelist backed by a fixed collection of dotted paths.
     * Index segments in the listed paths are stripped as well.
     *
     * @param paths allowed dotted paths
     * @return a whitelist admitting exactly those paths
     */
    static FieldWhitelist of(Collection<String> paths) {
        Set<String> allowed = paths.stream()
                .map(PathUtils::stripIndexSegments)
                .collect(Collectors.toUnmodifiableSet());
        return allowed::contains;
    }
}

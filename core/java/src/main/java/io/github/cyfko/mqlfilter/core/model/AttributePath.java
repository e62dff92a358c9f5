package io.github.cyfko.mqlfilter.core.model;

import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.utils.PathUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A dotted path resolved against a root model.
 * <p>
 * Pairs the path as written by the user ({@code externalName}) and after key translation
 * ({@code internalName}) with the chain of {@link FieldDescriptor}s it walks through. The
 * chain has one descriptor per internal segment; an index segment repeats the relation
 * descriptor preceding it.
 * </p>
 *
 * <pre>{@code
 * // Album root, "tracks.0.playlists.name"
 * descriptors       = [Relation tracks, Relation tracks, Relation playlists, Scalar name]
 * relationCrossings = [1, 2]
 * }</pre>
 *
 * @param root         model the path starts from
 * @param externalName dotted path as written in the filter document
 * @param internalName dotted path after key translation
 * @param descriptors  resolved descriptor chain
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AttributePath(
        SchemaModel root,
        String externalName,
        String internalName,
        List<FieldDescriptor> descriptors
) {

    public AttributePath {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(externalName, "externalName");
        Objects.requireNonNull(internalName, "internalName");
        descriptors = List.copyOf(descriptors);
    }

    /**
     * @return the internal path segments
     */
    public List<String> internalSegments() {
        return PathUtils.split(internalName);
    }

    /**
     * @return the external path segments
     */
    public List<String> externalSegments() {
        return PathUtils.split(externalName);
    }

    /**
     * @return {@code true} if the path resolves to no descriptor at all (the root itself)
     */
    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    /**
     * @return the last descriptor of the chain, or {@code null} for the empty path
     */
    public FieldDescriptor leaf() {
        return descriptors.isEmpty() ? null : descriptors.get(descriptors.size() - 1);
    }

    /**
     * Positions of the descriptors that open an existential scope.
     * <p>
     * A descriptor at position {@code i} is a crossing if it is a relation and either it is the
     * last one or segment {@code i + 1} is not an index segment.
     * </p>
     *
     * @return ascending crossing positions
     */
    public List<Integer> relationCrossings() {
        List<String> segments = internalSegments();
        List<Integer> crossings = new ArrayList<>();
        for (int i = 0; i < descriptors.size(); i++) {
            if (!descriptors.get(i).isRelation()) {
                continue;
            }
            if (i == descriptors.size() - 1 || !PathUtils.isIndexSegment(segments.get(i + 1))) {
                crossings.add(i);
            }
        }
        return crossings;
    }

    @Override
    public String toString() {
        return "AttributePath[" + root.name() + (internalName.isEmpty() ? "" : "." + internalName) + "]";
    }
}

package io.github.cyfko.mqlfilter.core.parsing;

import io.github.cyfko.mqlfilter.core.exception.UnknownFieldException;
import io.github.cyfko.mqlfilter.core.model.AttributePath;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.MessageFormatter;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.utils.PathUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves dotted paths against a root {@link SchemaModel}.
 * <p>
 * Segments are walked left to right. After a {@link FieldDescriptor.Relation} the walk continues
 * on the relation's target model, except for an index segment (one starting with a digit),
 * which repeats the relation descriptor and selects nothing.
 * </p>
 *
 * <pre>{@code
 * resolver.resolve(album, "tracks.playlists.name", "tracks.playlists.name", null);
 * // [Relation tracks, Relation playlists, Scalar name]
 *
 * resolver.resolve(album, "title.length", "title.length", null);
 * // UnknownFieldException: segment after a scalar
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PathResolver {

    static final String UNKNOWN_FIELD_MESSAGE = "Unknown field '%s' on %s.";
    static final String EMPTY_SEGMENT_MESSAGE = "Empty segment in field path '%s'.";
    static final String SCALAR_TRAVERSAL_MESSAGE = "Field '%s' is not a relation and has no sub-field '%s'.";

    private final MessageFormatter messageFormatter;

    public PathResolver(MessageFormatter messageFormatter) {
        this.messageFormatter = Objects.requireNonNull(messageFormatter, "messageFormatter");
    }

    /**
     * Resolves an internal dotted path into its descriptor chain.
     *
     * @param root         root model
     * @param internalPath internal dotted path relative to the root; the empty path yields an empty chain
     * @param dataKey      path reported on failure, as written by the user
     * @param filter       filter fragment reported on failure
     * @return one descriptor per segment
     * @throws UnknownFieldException if a segment does not resolve
     */
    public List<FieldDescriptor> resolve(SchemaModel root, String internalPath, String dataKey, Object filter) {
        List<FieldDescriptor> chain = new ArrayList<>();
        SchemaModel current = root;
        FieldDescriptor previous = null;

        for (String segment : PathUtils.split(internalPath)) {
            if (segment.isEmpty()) {
                throw new UnknownFieldException(dataKey, filter,
                        messageFormatter.format(EMPTY_SEGMENT_MESSAGE, dataKey));
            }
            if (previous instanceof FieldDescriptor.Relation relation) {
                if (PathUtils.isIndexSegment(segment)) {
                    chain.add(relation);
                    continue;
                }
                current = relation.target();
            } else if (previous != null) {
                throw new UnknownFieldException(dataKey, filter,
                        messageFormatter.format(SCALAR_TRAVERSAL_MESSAGE, previous.name(), segment));
            }

            SchemaModel owner = current;
            FieldDescriptor descriptor = owner.field(segment)
                    .orElseThrow(() -> new UnknownFieldException(dataKey, filter,
                            messageFormatter.format(UNKNOWN_FIELD_MESSAGE, segment, owner.name())));
            chain.add(descriptor);
            previous = descriptor;
        }
        return chain;
    }

    /**
     * Resolves a path into an {@link AttributePath}.
     *
     * @param root         root model
     * @param externalPath dotted path as written by the user
     * @param internalPath dotted path after key translation
     * @param filter       filter fragment reported on failure
     * @return the resolved path
     * @throws UnknownFieldException if a segment does not resolve
     */
    public AttributePath resolvePath(SchemaModel root, String externalPath, String internalPath, Object filter) {
        return new AttributePath(root, externalPath, internalPath, resolve(root, internalPath, externalPath, filter));
    }
}

package io.github.cyfko.mqlfilter.core.spi;

import java.util.Optional;

/**
 * Schema collaborator describing one entity type that filter documents can target.
 * <p>
 * The compiler never inspects entity classes itself: every field reference in a
 * filter document is looked up through this interface, one segment at a time,
 * and answered with a closed {@link FieldDescriptor}. Implementations are
 * typically backed by ORM metadata (see the JPA adapter) or built in memory with
 * {@link io.github.cyfko.mqlfilter.core.model.SimpleSchema}.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * SchemaModel album = schema.model("Album");
 * album.field("tracks");     // Optional[Relation[name=tracks, target=Track, cardinality=MANY]]
 * album.field("title");      // Optional[Scalar[name=title, type=TEXT]]
 * album.field("unknown");    // Optional.empty
 * }</pre>
 *
 * <p>
 * Implementations must be immutable once handed to the compiler: a single model
 * may be shared by concurrent compile calls.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FieldDescriptor
 */
public interface SchemaModel {

    /**
     * Returns the model name, used as the root segment of the compiler's path stacks.
     *
     * @return the non-null model name
     */
    String name();

    /**
     * Looks up a field declared on this model.
     *
     * @param fieldName the field name, never {@code null}
     * @return the field descriptor, or {@link Optional#empty()} if the model has no such field
     */
    Optional<FieldDescriptor> field(String fieldName);
}

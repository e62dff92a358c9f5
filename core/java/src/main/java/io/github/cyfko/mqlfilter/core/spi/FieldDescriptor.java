package io.github.cyfko.mqlfilter.core.spi;

import java.util.Objects;

/**
 * Closed description of a field declared on a {@link SchemaModel}.
 * <p>
 * A field is either a {@link Scalar} holding a single typed value, or a
 * {@link Relation} pointing at another model with a given {@link Cardinality}.
 * The compiler resolves every dotted path into a chain of these descriptors once
 * and then decides, from the chain alone, where existential scopes must be opened.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface FieldDescriptor {

    /**
     * Returns the field name as declared on its owning model.
     *
     * @return the field name
     */
    String name();

    /**
     * @return {@code true} if this descriptor is a {@link Relation}
     */
    default boolean isRelation() {
        return this instanceof Relation;
    }

    /**
     * Scalar field holding one value of the given {@link ValueType}.
     *
     * @param name field name
     * @param type canonical value type
     */
    record Scalar(String name, ValueType type) implements FieldDescriptor {
        public Scalar {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * Relation to another model.
     *
     * @param name        field name on the owning model
     * @param target      the related model
     * @param cardinality {@link Cardinality#ONE} for to-one, {@link Cardinality#MANY} for to-many
     */
    record Relation(String name, SchemaModel target, Cardinality cardinality) implements FieldDescriptor {
        public Relation {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(cardinality, "cardinality");
        }

        // target models may be self-referential, print the name only
        @Override
        public String toString() {
            return "Relation[name=" + name + ", target=" + target.name() + ", cardinality=" + cardinality + "]";
        }
    }
}

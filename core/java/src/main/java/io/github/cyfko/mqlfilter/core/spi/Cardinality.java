package io.github.cyfko.mqlfilter.core.spi;

/**
 * Cardinality of a relation between two schema models.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Cardinality {

    /** To-one relation: the related row, if present, must satisfy the inner predicate. */
    ONE,

    /** To-many relation: at least one related row must satisfy the inner predicate. */
    MANY
}

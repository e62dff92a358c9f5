package io.github.cyfko.mqlfilter.core.api;

/**
 * Primitive tests a {@link PredicateNode.Comparison} leaf applies to a scalar field.
 * <p>
 * These are the leaf-level operations a query engine has to support. Filter
 * operators that are not primitive are rewritten by the compiler:
 * {@code $nin} becomes {@code NOT(IN)} and {@code $exists} becomes
 * {@link #IS_NULL} / {@link #IS_NOT_NULL} on scalars.
 * </p>
 *
 * <p><strong>Value shapes:</strong></p>
 * <ul>
 *     <li>{@link #EQ}, {@link #NE}, {@link #LT}, {@link #LTE}, {@link #GT}, {@link #GTE}: the coerced scalar, possibly {@code null}</li>
 *     <li>{@link #LIKE}: a {@code String} pattern with {@code %} wildcards</li>
 *     <li>{@link #IN}: a {@code List} of coerced scalars</li>
 *     <li>{@link #MOD}: a {@link PredicateNode.Modulus}</li>
 *     <li>{@link #IS_NULL}, {@link #IS_NOT_NULL}: no value ({@code null})</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ComparisonOperator {

    /** Equality: "=" */
    EQ("="),

    /** Inequality: "!=" */
    NE("!="),

    /** Less than: "&lt;" */
    LT("<"),

    /** Less than or equal: "&lt;=" */
    LTE("<="),

    /** Greater than: "&gt;" */
    GT(">"),

    /** Greater than or equal: "&gt;=" */
    GTE(">="),

    /** Pattern matching: "LIKE" */
    LIKE("LIKE"),

    /** Set membership: "IN" */
    IN("IN"),

    /** Modulo test: "value % divisor = remainder" */
    MOD("%"),

    /** Null test: "IS NULL" */
    IS_NULL("IS NULL"),

    /** Non-null test: "IS NOT NULL" */
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the display symbol of the operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return {@code true} if leaves using this operator carry no value
     */
    public boolean isNullTest() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }
}

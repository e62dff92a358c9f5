package io.github.cyfko.mqlfilter.core.exception;

/**
 * Stable error codes carried by compile exceptions.
 * <p>
 * Codes are part of the public contract: applications may switch on them to build
 * localized feedback or map them to HTTP problem types. The string form returned by
 * {@link #getCode()} never changes between releases.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum MqlErrorCode {

    /** Unknown operator token, or operator not applicable to the field type. */
    INVALID_OP("invalid_op"),

    /** {@code $in} / {@code $nin} given something other than a list. */
    INVALID_IN_COMP("invalid_in_comp"),

    /** {@code $mod} operand is not a list of two integers with a non-zero divisor. */
    INVALID_MOD_VALUES("invalid_mod_values"),

    /** A relation compared to a primitive value or with a scalar operator. */
    INVALID_RELATION_COMP("invalid_relation_comp"),

    /** A scalar attribute compared to an object. */
    INVALID_ATTR_COMP("invalid_attr_comp"),

    /** A relation compared to an empty object. */
    INVALID_EMPTY_COMP("invalid_empty_comp"),

    /** {@code $elemMatch} applied to something other than a relation. */
    INVALID_ELEM_MATCH("invalid_elem_match"),

    /** {@code $and} / {@code $or} / {@code $nor} / {@code $not} given a malformed operand. */
    INVALID_LOGICAL_COMP("invalid_logical_comp"),

    /** A value could not be converted to the field's type. */
    DATA_CONVERSION_ERROR("data_conversion_error"),

    /** A field path does not resolve against the schema. */
    UNKNOWN_FIELD("unknown_field"),

    /** The whitelist rejected a field path. */
    INVALID_WHITELIST_PERMISSION("invalid_whitelist_permission"),

    /** The complexity limit was exceeded. */
    TOO_COMPLEX("too_complex");

    private final String code;

    MqlErrorCode(String code) {
        this.code = code;
    }

    /**
     * @return the stable string code, e.g. {@code "invalid_op"}
     */
    public String getCode() {
        return code;
    }
}

package io.github.cyfko.mqlfilter.core.api;

/**
 * Operator tokens accepted as keys of a filter document.
 * <p>
 * Tokens fall in three groups:
 * </p>
 * <ul>
 *     <li><strong>Logical:</strong> {@code $and}, {@code $or}, {@code $not}, {@code $nor}</li>
 *     <li><strong>Scope:</strong> {@code $elemMatch}, which opens an existential scope on a relation</li>
 *     <li><strong>Field:</strong> {@code $eq}, {@code $ne}, {@code $lt}, {@code $lte}, {@code $gt},
 *     {@code $gte}, {@code $in}, {@code $nin}, {@code $mod}, {@code $like}, {@code $exists}</li>
 * </ul>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * MqlOperator op = MqlOperator.fromToken("$gte");   // GTE
 * MqlOperator unknown = MqlOperator.fromToken("$regex"); // null
 *
 * if (op != null && op.isFieldOperator()) {
 *     // resolved against the currently open field
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum MqlOperator {

    AND("$and"),
    OR("$or"),
    NOT("$not"),
    NOR("$nor"),
    ELEM_MATCH("$elemMatch"),

    EQ("$eq"),
    NE("$ne"),
    LT("$lt"),
    LTE("$lte"),
    GT("$gt"),
    GTE("$gte"),
    IN("$in"),
    NIN("$nin"),
    MOD("$mod"),
    LIKE("$like"),
    EXISTS("$exists");

    /** Prefix marking a document key as an operator token. */
    public static final String PREFIX = "$";

    private final String token;

    MqlOperator(String token) {
        this.token = token;
    }

    /**
     * @return the token as written in filter documents, e.g. {@code "$elemMatch"}
     */
    public String getToken() {
        return token;
    }

    /**
     * Finds an operator by its exact token. Tokens are case-sensitive.
     *
     * @param token the key found in a filter document
     * @return the matching operator, or {@code null} if the token is unknown
     */
    public static MqlOperator fromToken(String token) {
        if (token == null) {
            return null;
        }
        for (MqlOperator op : values()) {
            if (op.token.equals(token)) {
                return op;
            }
        }
        return null;
    }

    /**
     * @param key a filter document key
     * @return {@code true} if the key is written as an operator token (starts with {@code $})
     */
    public static boolean isOperatorKey(String key) {
        return key != null && key.startsWith(PREFIX);
    }

    /**
     * @return {@code true} for operators applied to the currently open field
     */
    public boolean isFieldOperator() {
        return switch (this) {
            case AND, OR, NOT, NOR, ELEM_MATCH -> false;
            default -> true;
        };
    }
}

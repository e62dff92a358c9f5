package io.github.cyfko.mqlfilter.core.exception;

/**
 * Exception tied to one field reference or fragment of a filter document.
 * <p>
 * Besides the message and {@link MqlErrorCode}, it carries enough context for
 * precise client feedback:
 * </p>
 * <ul>
 *   <li><strong>dataKey</strong>: dotted path of the offending field, as written by the user
 *   (before key translation)</li>
 *   <li><strong>filter</strong>: the filter fragment applied to that field (a document or a literal)</li>
 *   <li><strong>op</strong>: the operator token being applied, or {@code null} for implicit
 *   equality and implicit {@code $elemMatch}</li>
 * </ul>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * {"tracks": 7}                    -> dataKey "tracks", op null,   code invalid_relation_comp
 * {"playlist_id": {"$in": 1}}      -> dataKey "playlist_id", op "$in", code invalid_in_comp
 * {"playlist_id": "abc"}           -> dataKey "playlist_id", op "$eq", code data_conversion_error
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MqlFieldException extends InvalidMqlException {

    private final String dataKey;
    private final transient Object filter;
    private final String op;

    /**
     * @param dataKey dotted path of the offending field
     * @param filter  offending filter fragment
     * @param op      operator token, or {@code null}
     * @param message description of the failure
     * @param code    stable error code
     */
    public MqlFieldException(String dataKey, Object filter, String op, String message, MqlErrorCode code) {
        super(message, code);
        this.dataKey = dataKey;
        this.filter = filter;
        this.op = op;
    }

    /**
     * @param dataKey dotted path of the offending field
     * @param filter  offending filter fragment
     * @param op      operator token, or {@code null}
     * @param message description of the failure
     * @param code    stable error code
     * @param cause   underlying cause, e.g. a {@link TypeConversionException}
     */
    public MqlFieldException(String dataKey, Object filter, String op, String message, MqlErrorCode code, Throwable cause) {
        super(message, code, cause);
        this.dataKey = dataKey;
        this.filter = filter;
        this.op = op;
    }

    public String getDataKey() {
        return dataKey;
    }

    public Object getFilter() {
        return filter;
    }

    public String getOp() {
        return op;
    }
}

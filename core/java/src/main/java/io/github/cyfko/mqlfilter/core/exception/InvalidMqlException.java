package io.github.cyfko.mqlfilter.core.exception;

/**
 * Base exception for every reason a filter document cannot be compiled.
 * <p>
 * Compilation is fail-fast: the first invalid fragment anywhere in the document
 * aborts the whole call with one instance of this hierarchy. There is no partial
 * result.
 * </p>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link MqlTooComplexException}: the document exceeds the configured complexity limit</li>
 *   <li>{@link MqlFieldException}: a specific field or fragment is invalid
 *     <ul>
 *       <li>{@link MqlFieldPermissionException}: the whitelist rejected the field</li>
 *       <li>{@link UnknownFieldException}: the field does not exist on the schema</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     PredicateNode predicate = compiler.compile(model, filters, options);
 * } catch (MqlFieldException e) {
 *     return ResponseEntity.badRequest().body(Map.of(
 *         "field", e.getDataKey(),
 *         "code", e.getCode().getCode(),
 *         "message", e.getMessage()));
 * } catch (InvalidMqlException e) {
 *     return ResponseEntity.badRequest().body(e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InvalidMqlException extends RuntimeException {

    private final MqlErrorCode code;

    /**
     * @param message description of the failure
     * @param code    stable error code
     */
    public InvalidMqlException(String message, MqlErrorCode code) {
        super(message);
        this.code = code;
    }

    /**
     * @param message description of the failure
     * @param code    stable error code
     * @param cause   underlying cause
     */
    public InvalidMqlException(String message, MqlErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * @return the stable error code
     */
    public MqlErrorCode getCode() {
        return code;
    }
}

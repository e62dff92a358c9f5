package io.github.cyfko.mqlfilter.core.exception;

/**
 * Thrown when a dotted path names a field its model does not declare.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownFieldException extends MqlFieldException {

    /**
     * @param dataKey dotted path that failed to resolve
     * @param filter  filter fragment applied to it
     * @param message description of the failure
     */
    public UnknownFieldException(String dataKey, Object filter, String message) {
        super(dataKey, filter, null, message, MqlErrorCode.UNKNOWN_FIELD);
    }
}

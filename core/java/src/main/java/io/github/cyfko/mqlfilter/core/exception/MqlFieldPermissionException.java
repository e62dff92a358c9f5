package io.github.cyfko.mqlfilter.core.exception;

/**
 * Thrown when the configured {@link io.github.cyfko.mqlfilter.core.spi.FieldWhitelist}
 * rejects a field path, even if the path resolves against the schema.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MqlFieldPermissionException extends MqlFieldException {

    /**
     * @param dataKey dotted path of the rejected field
     * @param filter  filter fragment applied to it
     * @param message description of the failure
     */
    public MqlFieldPermissionException(String dataKey, Object filter, String message) {
        super(dataKey, filter, null, message, MqlErrorCode.INVALID_WHITELIST_PERMISSION);
    }
}

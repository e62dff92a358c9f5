package io.github.cyfko.mqlfilter.core.exception;

/**
 * Thrown by {@link io.github.cyfko.mqlfilter.core.utils.TypeCoercion} when a raw filter
 * value cannot be converted to a field's {@link io.github.cyfko.mqlfilter.core.spi.ValueType}.
 * <p>
 * The exception carries no path information. The compiler catches it and rethrows an
 * {@link MqlFieldException} with code {@link MqlErrorCode#DATA_CONVERSION_ERROR}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TypeConversionException extends IllegalArgumentException {

    public TypeConversionException(String message) {
        super(message);
    }

    public TypeConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.github.cyfko.mqlfilter.core.exception;

/**
 * Thrown when a filter document exceeds the complexity limit of the active
 * {@link io.github.cyfko.mqlfilter.core.config.CompilePolicy}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MqlTooComplexException extends InvalidMqlException {

    private final int complexityLimit;

    /**
     * @param message         description of the failure
     * @param complexityLimit the limit that was exceeded
     */
    public MqlTooComplexException(String message, int complexityLimit) {
        super(message, MqlErrorCode.TOO_COMPLEX);
        this.complexityLimit = complexityLimit;
    }

    /**
     * @return the limit that was exceeded
     */
    public int getComplexityLimit() {
        return complexityLimit;
    }
}

package io.github.cyfko.mqlfilter.core.spi;

/**
 * Canonical scalar types a schema field may hold.
 * <p>
 * Each constant documents the Java representation produced by
 * {@link io.github.cyfko.mqlfilter.core.utils.TypeCoercion} for that type.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ValueType {

    /** Integral numbers, coerced to {@link Long}. */
    INT,

    /** Character data, coerced to {@link String}. */
    TEXT,

    /** Booleans, coerced to {@link Boolean}. */
    BOOL,

    /** Calendar dates, coerced to {@link java.time.LocalDate}. */
    DATE,

    /** Date and time of day, coerced to {@link java.time.LocalDateTime}. */
    DATETIME,

    /** Floating point numbers, coerced to {@link Double}. */
    FLOAT,

    /** Time of day, coerced to {@link java.time.LocalTime}. */
    TIME
}

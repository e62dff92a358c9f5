package io.github.cyfko.mqlfilter.core.utils;

import io.github.cyfko.mqlfilter.core.exception.TypeConversionException;
import io.github.cyfko.mqlfilter.core.spi.ValueType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Converts raw filter values into the canonical Java representation of a {@link ValueType}.
 * <p>
 * Raw values come from decoded JSON, so they are typically {@code String}, {@code Number},
 * {@code Boolean} or {@code null}. Already typed {@code java.time} values are accepted too.
 * </p>
 *
 * <h2>Conversion Rules</h2>
 * <table border="1">
 *   <caption>Canonical representations</caption>
 *   <tr><th>Type</th><th>Result</th><th>Accepted input</th></tr>
 *   <tr><td>INT</td><td>{@link Long}</td><td>numbers in the {@code long} range (fraction truncated), booleans (1/0), integer strings</td></tr>
 *   <tr><td>TEXT</td><td>{@link String}</td><td>anything, via {@code String.valueOf}</td></tr>
 *   <tr><td>BOOL</td><td>{@link Boolean}</td><td>"false", "0" and numeric zero are false, anything else true</td></tr>
 *   <tr><td>DATE</td><td>{@link LocalDate}</td><td>{@code yyyy-MM-dd}</td></tr>
 *   <tr><td>DATETIME</td><td>{@link LocalDateTime}</td><td>{@code yyyy-MM-dd HH:mm:ss}</td></tr>
 *   <tr><td>FLOAT</td><td>{@link Double}</td><td>finite numbers, booleans (1.0/0.0), decimal strings</td></tr>
 *   <tr><td>TIME</td><td>{@link LocalTime}</td><td>{@code HH:mm:ss}</td></tr>
 * </table>
 *
 * <p>
 * {@code null}, and any value whose string form is {@code "null"} (ignoring case), coerce to
 * {@code null} for every type.
 * </p>
 *
 * <p>
 * Values are never wrapped or clamped: an integer outside the {@code long} range, or a date such
 * as {@code 2021-02-30}, is rejected with a {@link TypeConversionException}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All methods are stateless and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeCoercion {

    public static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter DATETIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);
    public static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private TypeCoercion() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Coerces a raw value to the representation of {@code targetType}.
     *
     * @param value      raw filter value
     * @param targetType the field's value type
     * @return the coerced value, possibly {@code null}
     * @throws TypeConversionException if the type is unknown or the value cannot be converted
     */
    public static Object coerce(Object value, ValueType targetType) {
        if (isNullLiteral(value)) {
            return null;
        }
        if (targetType == null) {
            throw new TypeConversionException("Unable to convert value to an unknown type.");
        }

        try {
            return switch (targetType) {
                case INT -> toLong(value);
                case TEXT -> String.valueOf(value);
                case BOOL -> toBoolean(value);
                case DATE -> toDate(value);
                case DATETIME -> toDateTime(value);
                case FLOAT -> toDouble(value);
                case TIME -> toTime(value);
            };
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new TypeConversionException(
                    String.format("Unable to convert '%s' to %s.", value, targetType), e);
        }
    }

    /**
     * @param value raw value
     * @return {@code true} if the value is {@code null} or spells {@code "null"}
     */
    public static boolean isNullLiteral(Object value) {
        return value == null || "null".equalsIgnoreCase(String.valueOf(value));
    }

    /**
     * @param value raw value
     * @return {@code true} if the value is an integral number: a {@code Long}, {@code Integer},
     * {@code Short}, {@code Byte} or {@code BigInteger}, or a {@code BigDecimal} with no fractional part
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    /**
     * Converts a number to {@code long}, dropping any fractional part.
     *
     * @param number integral or floating point number
     * @return the integer part as a {@code long}
     * @throws ArithmeticException   if the integer part lies outside the {@code long} range
     * @throws NumberFormatException if the number is NaN or infinite
     */
    public static long toLongExact(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof BigInteger integer) {
            return integer.longValueExact();
        }
        if (number instanceof BigDecimal decimal) {
            return decimal.toBigInteger().longValueExact();
        }
        return BigDecimal.valueOf(number.doubleValue()).toBigInteger().longValueExact();
    }

    // ========================================
    // Per-type conversions
    // ========================================

    private static Long toLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Number number) {
            return toLongExact(number);
        }
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof String s) {
            return Long.parseLong(s.trim());
        }
        throw new TypeConversionException(
                String.format("Unable to convert %s to INT.", value.getClass().getSimpleName()));
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (value instanceof BigInteger integer) {
            return integer.signum() != 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        String s = String.valueOf(value);
        return !("false".equals(s.toLowerCase(Locale.ROOT)) || "0".equals(s));
    }

    private static Double toDouble(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isInfinite(d) && (number instanceof BigDecimal || number instanceof BigInteger)) {
                throw new ArithmeticException(number + " is out of the FLOAT range");
            }
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0d : 0.0d;
        }
        if (value instanceof String s) {
            return Double.parseDouble(s.trim());
        }
        throw new TypeConversionException(
                String.format("Unable to convert %s to FLOAT.", value.getClass().getSimpleName()));
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof String s) {
            return LocalDate.parse(s, DATE_FORMAT);
        }
        throw new TypeConversionException(
                String.format("Unable to convert %s to DATE.", value.getClass().getSimpleName()));
    }

    private static LocalDateTime toDateTime(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof String s) {
            return LocalDateTime.parse(s, DATETIME_FORMAT);
        }
        throw new TypeConversionException(
                String.format("Unable to convert %s to DATETIME.", value.getClass().getSimpleName()));
    }

    private static LocalTime toTime(Object value) {
        if (value instanceof LocalTime time) {
            return time;
        }
        if (value instanceof String s) {
            return LocalTime.parse(s, TIME_FORMAT);
        }
        throw new TypeConversionException(
                String.format("Unable to convert %s to TIME.", value.getClass().getSimpleName()));
    }
}

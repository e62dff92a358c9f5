package io.github.cyfko.mqlfilter.core.utils;

import io.github.cyfko.mqlfilter.core.exception.TypeConversionException;
import io.github.cyfko.mqlfilter.core.spi.ValueType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class TypeCoercionTest {

    @Nested
    class NullTests {

        @Test
        void shouldReturnNullForNullValue() {
            for (ValueType type : ValueType.values()) {
                assertNull(TypeCoercion.coerce(null, type));
            }
        }

        @Test
        void shouldReturnNullForNullLiteralIgnoringCase() {
            assertNull(TypeCoercion.coerce("null", ValueType.INT));
            assertNull(TypeCoercion.coerce("NULL", ValueType.TEXT));
            assertNull(TypeCoercion.coerce("Null", ValueType.DATE));
        }

        @Test
        void shouldRejectUnknownType() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("5", null));
        }
    }

    @Nested
    class IntTests {

        @Test
        void shouldParseIntegerString() {
            assertEquals(5L, TypeCoercion.coerce("5", ValueType.INT));
            assertEquals(-12L, TypeCoercion.coerce(" -12 ", ValueType.INT));
        }

        @Test
        void shouldWidenIntegralNumbers() {
            assertEquals(7L, TypeCoercion.coerce(7, ValueType.INT));
            assertEquals(7L, TypeCoercion.coerce(7L, ValueType.INT));
        }

        @Test
        void shouldTruncateFractionalNumbers() {
            assertEquals(5L, TypeCoercion.coerce(5.9d, ValueType.INT));
            assertEquals(2L, TypeCoercion.coerce(new BigDecimal("2.2"), ValueType.INT));
        }

        @Test
        void shouldConvertBooleans() {
            assertEquals(1L, TypeCoercion.coerce(true, ValueType.INT));
            assertEquals(0L, TypeCoercion.coerce(false, ValueType.INT));
        }

        @Test
        void shouldRejectNonNumericString() {
            TypeConversionException e = assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce("abc", ValueType.INT));
            assertInstanceOf(NumberFormatException.class, e.getCause());
        }

        @Test
        void shouldRejectDecimalString() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("2.5", ValueType.INT));
        }

        @Test
        void shouldAcceptLongBoundaries() {
            assertEquals(Long.MAX_VALUE, TypeCoercion.coerce(BigInteger.valueOf(Long.MAX_VALUE), ValueType.INT));
            assertEquals(Long.MIN_VALUE, TypeCoercion.coerce(new BigDecimal(Long.MIN_VALUE), ValueType.INT));
        }

        @Test
        void shouldRejectIntegersBeyondLongRange() {
            TypeConversionException e = assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce(new BigInteger("18446744073709551617"), ValueType.INT));
            assertInstanceOf(ArithmeticException.class, e.getCause());

            assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce(new BigDecimal("9223372036854775808"), ValueType.INT));
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce(1e19d, ValueType.INT));
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("9223372036854775808", ValueType.INT));
        }

        @Test
        void shouldRejectNonFiniteNumbers() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce(Double.NaN, ValueType.INT));
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce(Double.POSITIVE_INFINITY, ValueType.INT));
        }
    }

    @Nested
    class FloatTests {

        @Test
        void shouldParseDecimalString() {
            assertEquals(3.14d, TypeCoercion.coerce("3.14", ValueType.FLOAT));
        }

        @Test
        void shouldWidenNumbers() {
            assertEquals(3.0d, TypeCoercion.coerce(3, ValueType.FLOAT));
            assertEquals(0.99d, TypeCoercion.coerce(new BigDecimal("0.99"), ValueType.FLOAT));
        }

        @Test
        void shouldConvertBooleans() {
            assertEquals(1.0d, TypeCoercion.coerce(true, ValueType.FLOAT));
        }

        @Test
        void shouldRejectGarbage() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("1,5", ValueType.FLOAT));
        }

        @Test
        void shouldRejectNumbersBeyondDoubleRange() {
            assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce(BigInteger.TEN.pow(400), ValueType.FLOAT));
        }
    }

    @Nested
    class BoolTests {

        @Test
        void shouldPassBooleansThrough() {
            assertEquals(Boolean.TRUE, TypeCoercion.coerce(true, ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce(false, ValueType.BOOL));
        }

        @Test
        void shouldTreatFalseLikeValuesAsFalse() {
            assertEquals(Boolean.FALSE, TypeCoercion.coerce("false", ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce("FALSE", ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce("0", ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce(0, ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce(0.0d, ValueType.BOOL));
        }

        @Test
        void shouldTreatAnythingElseAsTrue() {
            assertEquals(Boolean.TRUE, TypeCoercion.coerce("true", ValueType.BOOL));
            assertEquals(Boolean.TRUE, TypeCoercion.coerce("yes", ValueType.BOOL));
            assertEquals(Boolean.TRUE, TypeCoercion.coerce(1, ValueType.BOOL));
            assertEquals(Boolean.TRUE, TypeCoercion.coerce("", ValueType.BOOL));
        }

        @Test
        void shouldUseSignOfArbitraryPrecisionNumbers() {
            assertEquals(Boolean.TRUE, TypeCoercion.coerce(new BigDecimal("1E-400"), ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce(new BigDecimal("0.000"), ValueType.BOOL));
            assertEquals(Boolean.FALSE, TypeCoercion.coerce(BigInteger.ZERO, ValueType.BOOL));
            assertEquals(Boolean.TRUE, TypeCoercion.coerce(BigInteger.TEN.pow(400).negate(), ValueType.BOOL));
        }
    }

    @Nested
    class TemporalTests {

        @Test
        void shouldParseDate() {
            assertEquals(LocalDate.of(2015, 1, 31), TypeCoercion.coerce("2015-01-31", ValueType.DATE));
        }

        @Test
        void shouldNarrowDateTimeToDate() {
            assertEquals(LocalDate.of(2015, 1, 31),
                    TypeCoercion.coerce(LocalDateTime.of(2015, 1, 31, 10, 0), ValueType.DATE));
        }

        @Test
        void shouldParseDateTime() {
            assertEquals(LocalDateTime.of(1962, 2, 18, 0, 0, 0),
                    TypeCoercion.coerce("1962-02-18 00:00:00", ValueType.DATETIME));
        }

        @Test
        void shouldParseTime() {
            assertEquals(LocalTime.of(8, 30, 15), TypeCoercion.coerce("08:30:15", ValueType.TIME));
        }

        @Test
        void shouldPassTemporalValuesThrough() {
            LocalTime time = LocalTime.NOON;
            assertSame(time, TypeCoercion.coerce(time, ValueType.TIME));
        }

        @Test
        void shouldRejectIsoDateTimeForDateTime() {
            assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce("1962-02-18T00:00:00", ValueType.DATETIME));
        }

        @Test
        void shouldRejectImpossibleCalendarValues() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("2021-02-30", ValueType.DATE));
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("2021-04-31", ValueType.DATE));
            assertThrows(TypeConversionException.class,
                    () -> TypeCoercion.coerce("2021-02-29 10:00:00", ValueType.DATETIME));
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce("24:00:00", ValueType.TIME));
        }

        @Test
        void shouldAcceptLeapDay() {
            assertEquals(LocalDate.of(2020, 2, 29), TypeCoercion.coerce("2020-02-29", ValueType.DATE));
        }

        @Test
        void shouldRejectNumbersForDates() {
            assertThrows(TypeConversionException.class, () -> TypeCoercion.coerce(20150131, ValueType.DATE));
        }
    }

    @Test
    void shouldConvertAnythingToText() {
        assertEquals("5", TypeCoercion.coerce(5, ValueType.TEXT));
        assertEquals("true", TypeCoercion.coerce(true, ValueType.TEXT));
    }

    @Test
    void shouldDetectIntegralValues() {
        assertTrue(TypeCoercion.isIntegral(2));
        assertTrue(TypeCoercion.isIntegral(2L));
        assertTrue(TypeCoercion.isIntegral(new BigDecimal("4.00")));
        assertFalse(TypeCoercion.isIntegral(new BigDecimal("4.4")));
        assertFalse(TypeCoercion.isIntegral(2.0d));
        assertFalse(TypeCoercion.isIntegral("2"));
        assertFalse(TypeCoercion.isIntegral(true));
    }
}

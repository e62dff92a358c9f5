package io.github.cyfko.mqlfilter.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Compile exception hierarchy Tests")
class MqlExceptionTest {

    @Test
    @DisplayName("Should expose stable string codes")
    void shouldExposeStableCodes() {
        assertEquals(List.of(
                "invalid_op", "invalid_in_comp", "invalid_mod_values", "invalid_relation_comp",
                "invalid_attr_comp", "invalid_empty_comp", "invalid_elem_match", "invalid_logical_comp",
                "data_conversion_error", "unknown_field", "invalid_whitelist_permission", "too_complex"),
                Arrays.stream(MqlErrorCode.values()).map(MqlErrorCode::getCode).toList());
    }

    @Test
    @DisplayName("Should carry field context")
    void shouldCarryFieldContext() {
        Map<String, Object> filter = Map.of("$in", 1);
        TypeConversionException cause = new TypeConversionException("not a number");

        MqlFieldException e = new MqlFieldException("tracks.track_id", filter, "$in", "bad", MqlErrorCode.INVALID_IN_COMP, cause);

        assertEquals("tracks.track_id", e.getDataKey());
        assertSame(filter, e.getFilter());
        assertEquals("$in", e.getOp());
        assertEquals("bad", e.getMessage());
        assertSame(cause, e.getCause());
        assertInstanceOf(InvalidMqlException.class, e);
        assertInstanceOf(RuntimeException.class, e);
    }

    @Test
    @DisplayName("Should fix codes of specialized exceptions")
    void shouldFixSpecializedCodes() {
        assertEquals(MqlErrorCode.INVALID_WHITELIST_PERMISSION, new MqlFieldPermissionException("title", "A", "no").getCode());
        assertEquals(MqlErrorCode.UNKNOWN_FIELD, new UnknownFieldException("genre", "Rock", "no").getCode());
        assertNull(new UnknownFieldException("genre", "Rock", "no").getOp());

        MqlTooComplexException tooComplex = new MqlTooComplexException("too complex", 100);
        assertEquals(MqlErrorCode.TOO_COMPLEX, tooComplex.getCode());
        assertEquals(100, tooComplex.getComplexityLimit());
    }

    @Test
    @DisplayName("Conversion failures are illegal arguments")
    void conversionFailuresAreIllegalArguments() {
        assertInstanceOf(IllegalArgumentException.class, new TypeConversionException("x"));
    }
}

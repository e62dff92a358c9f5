package io.github.cyfko.mqlfilter.core.impl;

import io.github.cyfko.mqlfilter.core.api.FilterCompiler;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.config.CompileOptions;
import io.github.cyfko.mqlfilter.core.config.CompilePolicy;
import io.github.cyfko.mqlfilter.core.exception.MqlErrorCode;
import io.github.cyfko.mqlfilter.core.exception.MqlTooComplexException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.github.cyfko.mqlfilter.core.ChinookSchema.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Work stack bounds applied by {@link CompilePolicy}.
 */
@DisplayName("BasicFilterCompiler Complexity Limits Tests")
class BasicFilterCompilerComplexityLimitsTest {

    private final FilterCompiler compiler = new BasicFilterCompiler();

    private static CompileOptions limit(int complexityLimit) {
        return CompileOptions.builder()
                .policy(CompilePolicy.builder().complexityLimit(complexityLimit).build())
                .build();
    }

    private static Map<String, Object> wideOr(int branches) {
        List<Object> documents = new ArrayList<>();
        for (int i = 0; i < branches; i++) {
            documents.add(doc("album_id", i));
        }
        return doc("$or", documents);
    }

    private static Map<String, Object> deepNot(int depth) {
        Map<String, Object> document = doc("title", "A");
        for (int i = 0; i < depth; i++) {
            document = doc("$not", document);
        }
        return document;
    }

    @Test
    @DisplayName("Tight limit rejects a two-key document")
    void testTightLimit() {
        MqlTooComplexException e = assertThrows(MqlTooComplexException.class,
                () -> compiler.compile(album(), doc("title", "A", "album_id", 1), limit(1)));

        assertEquals(MqlErrorCode.TOO_COMPLEX, e.getCode());
        assertEquals(1, e.getComplexityLimit());
        assertEquals("This query is too complex.", e.getMessage());
    }

    @Test
    @DisplayName("Sufficient limit accepts the same document")
    void testSufficientLimit() {
        PredicateNode limited = compiler.compile(album(), doc("title", "A", "album_id", 1), limit(10));

        assertEquals(compiler.compile(album(), doc("title", "A", "album_id", 1)), limited);
    }

    @Test
    @DisplayName("Strict policy bounds breadth")
    void testStrictBreadth() {
        CompileOptions strict = CompileOptions.builder().policy(CompilePolicy.strict()).build();

        assertDoesNotThrow(() -> compiler.compile(album(), wideOr(20), strict));
        assertThrows(MqlTooComplexException.class, () -> compiler.compile(album(), wideOr(200), strict));
    }

    @Test
    @DisplayName("Strict policy bounds depth")
    void testStrictDepth() {
        CompileOptions strict = CompileOptions.builder().policy(CompilePolicy.strict()).build();

        assertDoesNotThrow(() -> compiler.compile(album(), deepNot(10), strict));
        assertThrows(MqlTooComplexException.class, () -> compiler.compile(album(), deepNot(200), strict));
    }

    @Test
    @DisplayName("Relaxed policy admits large generated documents")
    void testRelaxed() {
        CompileOptions relaxed = CompileOptions.builder().policy(CompilePolicy.relaxed()).build();

        PredicateNode result = compiler.compile(album(), wideOr(200), relaxed);

        assertEquals(200, ((PredicateNode.Or) result).children().size());
    }

    @Test
    @DisplayName("Unlimited policy compiles deep nesting without recursion")
    void testUnlimitedDepth() {
        PredicateNode result = compiler.compile(album(), deepNot(5_000));

        assertInstanceOf(PredicateNode.Not.class, result);
    }
}

package io.github.cyfko.mqlfilter.core.api;

import io.github.cyfko.mqlfilter.core.config.CompileOptions;
import io.github.cyfko.mqlfilter.core.exception.InvalidMqlException;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;

import java.util.Map;

/**
 * Compiles MongoDB-style filter documents into {@link PredicateNode} trees.
 * <p>
 * A filter document is a nested {@code Map} whose keys are field names, dotted
 * field paths or operator tokens (see {@link MqlOperator}). Relations of the
 * schema are treated the way a document store treats embedded documents: a
 * path crossing a relation opens an existential scope over it.
 * </p>
 *
 * <h2>Grammar (informal)</h2>
 * <pre>
 * document   := { entry* }
 * entry      := field ':' (literal | document)
 *             | ('$and' | '$or' | '$nor') ':' [ document* ]
 *             | '$not' ':' document
 *             | '$elemMatch' ':' document
 *             | fieldOp ':' value
 * field      := segment ('.' segment)*
 * fieldOp    := '$eq' | '$ne' | '$lt' | '$lte' | '$gt' | '$gte'
 *             | '$in' | '$nin' | '$mod' | '$like' | '$exists'
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FilterCompiler compiler = new BasicFilterCompiler();
 *
 * PredicateNode predicate = compiler.compile(album, Map.of(
 *     "title", Map.of("$like", "Rock"),
 *     "tracks.playlists.name", "Music"
 * ), CompileOptions.builder()
 *     .whitelist(FieldWhitelist.of(List.of("title", "tracks.playlists.name")))
 *     .policy(CompilePolicy.strict())
 *     .build());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations are stateless between calls and may be shared across threads,
 * provided the callables in {@link CompileOptions} are themselves thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see CompileOptions
 * @see PredicateNode
 */
public interface FilterCompiler {

    /**
     * Compiles a filter document with the given options.
     *
     * @param root     root model the document filters
     * @param document filter document; {@code null} yields the vacuous true
     * @param options  compile options
     * @return the compiled predicate, to be AND-ed onto the caller's query
     * @throws InvalidMqlException if the document is invalid, forbidden or too complex
     */
    PredicateNode compile(SchemaModel root, Map<String, ?> document, CompileOptions options) throws InvalidMqlException;

    /**
     * Compiles a filter document with {@link CompileOptions#defaults()}.
     *
     * @param root     root model the document filters
     * @param document filter document; {@code null} yields the vacuous true
     * @return the compiled predicate
     * @throws InvalidMqlException if the document is invalid
     */
    default PredicateNode compile(SchemaModel root, Map<String, ?> document) throws InvalidMqlException {
        return compile(root, document, CompileOptions.defaults());
    }
}

package io.github.cyfko.mqlfilter.core.impl;

import io.github.cyfko.mqlfilter.core.api.FilterCompiler;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.config.CompileOptions;
import io.github.cyfko.mqlfilter.core.exception.InvalidMqlException;
import io.github.cyfko.mqlfilter.core.exception.MqlFieldException;
import io.github.cyfko.mqlfilter.core.parsing.BoundaryManager;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link FilterCompiler}.
 * <p>
 * Validates its arguments and runs a fresh {@link BoundaryManager} per call. The compiler
 * itself holds no state, so one instance can be shared by the whole application.
 * </p>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * The work performed per call is bounded by the complexity limit of
 * {@link CompileOptions#getPolicy()}. Use {@link io.github.cyfko.mqlfilter.core.config.CompilePolicy#strict()}
 * for documents received from untrusted clients.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FilterCompiler compiler = new BasicFilterCompiler();
 * PredicateNode predicate = compiler.compile(album, Map.of("tracks.name", "Hand In My Pocket"));
 * // Exists[relation=tracks, cardinality=MANY,
 * //        inner=Comparison[field=name, type=TEXT, operator=EQ, value=Hand In My Pocket]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFilterCompiler implements FilterCompiler {

    private static final Logger log = Logger.getLogger(BasicFilterCompiler.class.getName());

    @Override
    public PredicateNode compile(SchemaModel root, Map<String, ?> document, CompileOptions options) throws InvalidMqlException {
        Objects.requireNonNull(root, "Root model cannot be null");
        Objects.requireNonNull(options, "CompileOptions cannot be null");

        log.fine(() -> String.format(
                "Compiling filter document on %s: policy=%s",
                root.name(),
                options.getPolicy().policyName()
        ));

        long start = System.nanoTime();
        PredicateNode predicate;
        try {
            predicate = new BoundaryManager(root, options).compile(document);
        } catch (MqlFieldException e) {
            log.fine(() -> String.format("Rejected filter document on %s: code=%s, dataKey=%s",
                    root.name(), e.getCode().getCode(), e.getDataKey()));
            throw e;
        } catch (InvalidMqlException e) {
            log.fine(() -> String.format("Rejected filter document on %s: code=%s",
                    root.name(), e.getCode().getCode()));
            throw e;
        }
        long durationMicros = (System.nanoTime() - start) / 1_000;

        log.fine(() -> String.format("Filter document on %s compiled in %d us", root.name(), durationMicros));
        return predicate;
    }
}

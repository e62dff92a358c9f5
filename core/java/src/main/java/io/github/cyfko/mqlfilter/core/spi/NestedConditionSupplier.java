package io.github.cyfko.mqlfilter.core.spi;

import io.github.cyfko.mqlfilter.core.api.PredicateNode;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Supplies mandatory predicates injected into every existential scope opened on a relation.
 * <p>
 * This is the row-level-security hook of the compiler. Whenever the compiler opens
 * an {@code Exists} scope on a relation, it asks this supplier for conditions
 * registered under the relation's internal, index-stripped dotted path (e.g.
 * {@code "tracks.playlists"} for an {@code Album} root) and AND-s every returned
 * predicate into the scope, whether or not the user filter mentions them. The
 * supplier is invoked exactly once per opened scope.
 * </p>
 * <p>
 * Returned predicates are expressed relative to the relation's <em>target</em>
 * model: a {@link PredicateNode.Comparison} on {@code name} inside the
 * {@code tracks.playlists} scope compares {@code Playlist.name}.
 * </p>
 *
 * <pre>{@code
 * // hide private playlists whatever the user asks for
 * NestedConditionSupplier hidePrivate = path -> "tracks.playlists".equals(path)
 *     ? List.of(PredicateNode.not(PredicateNode.comparison("name", ValueType.TEXT, ComparisonOperator.LIKE, "%Private%")))
 *     : List.of();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface NestedConditionSupplier {

    /**
     * @param relationPath internal, index-stripped dotted path of the relation from the root model
     * @return predicates to AND into the scope; an empty list (or {@code null}) when none apply
     */
    List<PredicateNode> conditionsFor(String relationPath);

    /**
     * @return a supplier that never injects anything
     */
    static NestedConditionSupplier none() {
        return path -> List.of();
    }

    /**
     * Supplier backed by a map from relation path to its mandatory predicates.
     *
     * @param conditions predicates keyed by relation path
     * @return a map-backed supplier
     */
    static NestedConditionSupplier of(Map<String, ? extends Collection<? extends PredicateNode>> conditions) {
        Map<String, List<PredicateNode>> copy = new HashMap<>();
        conditions.forEach((path, predicates) -> copy.put(path, List.copyOf(predicates)));
        return path -> copy.getOrDefault(path, List.of());
    }
}

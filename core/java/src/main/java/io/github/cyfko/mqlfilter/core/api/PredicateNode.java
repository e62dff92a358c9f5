package io.github.cyfko.mqlfilter.core.api;

import io.github.cyfko.mqlfilter.core.spi.Cardinality;
import io.github.cyfko.mqlfilter.core.spi.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Backend-agnostic boolean predicate tree produced by the compiler.
 * <p>
 * The tree is a closed union of five node kinds:
 * </p>
 * <ul>
 *   <li>{@link And} / {@link Or}: n-ary combinations; an empty {@code And} is the vacuous true</li>
 *   <li>{@link Not}: negation of a single child</li>
 *   <li>{@link Exists}: existential scope over a relation of the enclosing model; its inner
 *       predicate is evaluated against the relation's target model</li>
 *   <li>{@link Comparison}: primitive test on a scalar field of the enclosing model</li>
 * </ul>
 *
 * <p>
 * Nodes are immutable value objects: two compilations of equivalent documents yield
 * {@code equals} trees, which makes them easy to compare in tests and to cache.
 * Backends consume the tree through {@link #accept(Visitor)}.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // {"title": "Jagged Little Pill", "tracks.name": {"$like": "Hand"}} on Album
 * And[children=[
 *     Comparison[field=title, type=TEXT, operator=EQ, value=Jagged Little Pill],
 *     Exists[relation=tracks, cardinality=MANY,
 *            inner=Comparison[field=name, type=TEXT, operator=LIKE, value=%Hand%]]]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Visitor
 */
public interface PredicateNode {

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor the visitor
     * @param <R>     result type
     * @return the visitor's result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over the closed set of node kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitAnd(And node);

        R visitOr(Or node);

        R visitNot(Not node);

        R visitExists(Exists node);

        R visitComparison(Comparison node);
    }

    /**
     * Conjunction of its children. An empty list is the vacuous true.
     *
     * @param children combined predicates
     */
    record And(List<PredicateNode> children) implements PredicateNode {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    /**
     * Disjunction of its children. An empty list is treated as the vacuous true.
     *
     * @param children combined predicates
     */
    record Or(List<PredicateNode> children) implements PredicateNode {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    /**
     * Negation.
     *
     * @param child negated predicate
     */
    record Not(PredicateNode child) implements PredicateNode {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    /**
     * Existential quantifier over a relation of the enclosing model.
     * <p>
     * With {@link Cardinality#MANY} at least one related row must satisfy {@code inner};
     * with {@link Cardinality#ONE} the related row must exist and satisfy it.
     * </p>
     *
     * @param relation    relation field name on the enclosing model
     * @param cardinality relation cardinality
     * @param inner       predicate over the relation's target model
     */
    record Exists(String relation, Cardinality cardinality, PredicateNode inner) implements PredicateNode {
        public Exists {
            Objects.requireNonNull(relation, "relation");
            Objects.requireNonNull(cardinality, "cardinality");
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExists(this);
        }
    }

    /**
     * Primitive test on a scalar field of the enclosing model.
     *
     * @param field    scalar field name
     * @param type     field value type
     * @param operator the test applied
     * @param value    coerced operand; see {@link ComparisonOperator} for the expected shape
     */
    record Comparison(String field, ValueType type, ComparisonOperator operator, Object value) implements PredicateNode {
        public Comparison {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(operator, "operator");
            if (value instanceof List<?> list) {
                // elements may be null after coercion, List.copyOf would reject them
                value = Collections.unmodifiableList(new ArrayList<>(list));
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /**
     * Operand of a {@link ComparisonOperator#MOD} comparison: {@code value % divisor == remainder}.
     *
     * @param divisor   non-zero divisor
     * @param remainder expected remainder
     */
    record Modulus(long divisor, long remainder) {
    }

    // ==================== Factories ====================

    /**
     * @return the vacuous true, an empty {@link And}
     */
    static PredicateNode alwaysTrue() {
        return new And(List.of());
    }

    /**
     * Combines predicates with AND. No predicate yields the vacuous true, a single one is returned as is.
     *
     * @param children predicates to combine
     * @return the combined predicate
     */
    static PredicateNode and(List<PredicateNode> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        return new And(children);
    }

    /**
     * Combines predicates with OR. No predicate yields the vacuous true, a single one is returned as is.
     *
     * @param children predicates to combine
     * @return the combined predicate
     */
    static PredicateNode or(List<PredicateNode> children) {
        if (children.isEmpty()) {
            return alwaysTrue();
        }
        if (children.size() == 1) {
            return children.get(0);
        }
        return new Or(children);
    }

    /**
     * @param child predicate to negate
     * @return the negation
     */
    static PredicateNode not(PredicateNode child) {
        return new Not(child);
    }

    /**
     * @param relation    relation name
     * @param cardinality relation cardinality
     * @param inner       inner predicate
     * @return an existential scope
     */
    static PredicateNode exists(String relation, Cardinality cardinality, PredicateNode inner) {
        return new Exists(relation, cardinality, inner);
    }

    /**
     * @param field    scalar field name
     * @param type     field value type
     * @param operator the test
     * @param value    coerced operand
     * @return a comparison leaf
     */
    static PredicateNode comparison(String field, ValueType type, ComparisonOperator operator, Object value) {
        return new Comparison(field, type, operator, value);
    }
}

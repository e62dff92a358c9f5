package io.github.cyfko.mqlfilter.core.parsing;

import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One level of the predicate tree under construction.
 * <p>
 * Frames collect the predicates produced while their part of the document is processed,
 * and fold them into a single node once that part is done.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class ScopeFrame {

    enum Combinator {
        AND,
        OR,
        NOT,
        EXISTS
    }

    private final Combinator combinator;
    private final FieldDescriptor.Relation relation;
    private final List<PredicateNode> accumulated = new ArrayList<>();

    private ScopeFrame(Combinator combinator, FieldDescriptor.Relation relation) {
        this.combinator = combinator;
        this.relation = relation;
    }

    static ScopeFrame of(Combinator combinator) {
        if (combinator == Combinator.EXISTS) {
            throw new IllegalArgumentException("EXISTS frames need a relation");
        }
        return new ScopeFrame(combinator, null);
    }

    /**
     * @param relation   relation the scope quantifies over
     * @param conditions mandatory predicates seeded into the scope
     */
    static ScopeFrame exists(FieldDescriptor.Relation relation, List<PredicateNode> conditions) {
        ScopeFrame frame = new ScopeFrame(Combinator.EXISTS, Objects.requireNonNull(relation, "relation"));
        frame.accumulated.addAll(conditions);
        return frame;
    }

    Combinator combinator() {
        return combinator;
    }

    void add(PredicateNode predicate) {
        accumulated.add(predicate);
    }

    List<PredicateNode> accumulated() {
        return accumulated;
    }

    /**
     * Folds the accumulated predicates: n-ary for AND / OR, negation of their conjunction for NOT,
     * existential scope over their conjunction for EXISTS. An empty frame folds to the vacuous true
     * before the combinator is applied.
     *
     * @return the folded predicate
     */
    PredicateNode close() {
        return switch (combinator) {
            case AND -> PredicateNode.and(accumulated);
            case OR -> PredicateNode.or(accumulated);
            case NOT -> PredicateNode.not(PredicateNode.and(accumulated));
            case EXISTS -> PredicateNode.exists(relation.name(), relation.cardinality(), PredicateNode.and(accumulated));
        };
    }
}

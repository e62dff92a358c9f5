package io.github.cyfko.mqlfilter.jpa;

import io.github.cyfko.mqlfilter.core.api.ComparisonOperator;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import jakarta.persistence.criteria.AbstractQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Translates compiled {@link PredicateNode} trees into JPA Criteria predicates.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>{@code And} / {@code Or} / {@code Not}: {@code cb.and} / {@code cb.or} / {@code cb.not};
 *   an empty {@code And} is the always-true conjunction</li>
 *   <li>{@code Exists}: correlated {@code EXISTS} subquery joining the relation from the
 *   enclosing entity; the inner predicate is built on the join</li>
 *   <li>{@code Comparison}: the matching {@link CriteriaBuilder} test on the attribute, with
 *   {@code EQ null} / {@code NE null} turned into {@code IS NULL} / {@code IS NOT NULL}</li>
 * </ul>
 *
 * <p>
 * Compiled values are {@code Long} for integers and {@code Double} for floats. Before they
 * reach the query they are narrowed to the Java type of the attribute they are compared
 * with ({@code Integer}, {@code BigDecimal}, enum constants...). A value outside the range of
 * an integral attribute type is never truncated: the comparison is decided on the range alone,
 * so {@code EQ} matches no row and {@code NE} matches every non-null row.
 * </p>
 *
 * <pre>{@code
 * PredicateNode predicate = compiler.compile(schema.model(Album.class), document);
 * PredicateResolver<Album> resolver = new JpaPredicateTranslator().translate(predicate);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaPredicateTranslator {

    private static final Logger log = Logger.getLogger(JpaPredicateTranslator.class.getName());

    /**
     * @param predicate compiled predicate, relative to the entity of the resolver's root
     * @param <E>       entity type
     * @return a resolver building the Criteria predicate on demand
     */
    public <E> PredicateResolver<E> translate(PredicateNode predicate) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return (root, query, cb) -> {
            log.fine(() -> String.format("Translating predicate on %s", root.getModel().getName()));
            return predicate.accept(new CriteriaVisitor(root, query, cb));
        };
    }

    /**
     * Builds predicates relative to one {@link From}: the query root, or the join of an enclosing
     * {@code EXISTS} subquery.
     */
    private static final class CriteriaVisitor implements PredicateNode.Visitor<Predicate> {

        private final From<?, ?> from;
        private final AbstractQuery<?> query;
        private final CriteriaBuilder cb;

        private CriteriaVisitor(From<?, ?> from, AbstractQuery<?> query, CriteriaBuilder cb) {
            this.from = from;
            this.query = query;
            this.cb = cb;
        }

        @Override
        public Predicate visitAnd(PredicateNode.And node) {
            return cb.and(visitAll(node.children()));
        }

        @Override
        public Predicate visitOr(PredicateNode.Or node) {
            return cb.or(visitAll(node.children()));
        }

        @Override
        public Predicate visitNot(PredicateNode.Not node) {
            return cb.not(node.child().accept(this));
        }

        @Override
        public Predicate visitExists(PredicateNode.Exists node) {
            Subquery<Integer> subquery = query.subquery(Integer.class);
            Join<?, ?> relation = correlate(subquery, from).join(node.relation());

            log.finer(() -> String.format("Building EXISTS subquery on %s.%s (%s)",
                    from.getJavaType().getSimpleName(), node.relation(), node.cardinality()));

            Predicate inner = node.inner().accept(new CriteriaVisitor(relation, subquery, cb));
            subquery.select(cb.literal(1)).where(inner);
            return cb.exists(subquery);
        }

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public Predicate visitComparison(PredicateNode.Comparison node) {
            Path<?> path = from.get(node.field());
            Class<?> javaType = path.getJavaType();
            Object value = node.value();

            if (value instanceof Number number && !fits(number, javaType)) {
                return outOfRange(node.operator(), path, number);
            }
            return switch (node.operator()) {
                case EQ -> value == null ? cb.isNull(path) : cb.equal(path, narrow(value, javaType));
                case NE -> value == null ? cb.isNotNull(path) : cb.notEqual(path, narrow(value, javaType));
                case LT -> value == null ? cb.disjunction()
                        : cb.lessThan((Expression<Comparable>) path, (Comparable) narrow(value, javaType));
                case LTE -> value == null ? cb.disjunction()
                        : cb.lessThanOrEqualTo((Expression<Comparable>) path, (Comparable) narrow(value, javaType));
                case GT -> value == null ? cb.disjunction()
                        : cb.greaterThan((Expression<Comparable>) path, (Comparable) narrow(value, javaType));
                case GTE -> value == null ? cb.disjunction()
                        : cb.greaterThanOrEqualTo((Expression<Comparable>) path, (Comparable) narrow(value, javaType));
                case LIKE -> cb.like(path.as(String.class), String.valueOf(value));
                case IN -> in(path, (List<?>) value);
                case MOD -> mod(path, (PredicateNode.Modulus) value);
                case IS_NULL -> cb.isNull(path);
                case IS_NOT_NULL -> cb.isNotNull(path);
            };
        }

        @SuppressWarnings("unchecked")
        private Predicate in(Path<?> path, List<?> values) {
            CriteriaBuilder.In<Object> in = cb.in((Path<Object>) path);
            int count = 0;
            for (Object value : values) {
                // a NULL member never matches in SQL, nor does one outside the attribute range
                if (value == null || (value instanceof Number number && !fits(number, path.getJavaType()))) {
                    continue;
                }
                in.value(narrow(value, path.getJavaType()));
                count++;
            }
            return count == 0 ? cb.disjunction() : in;
        }

        private Predicate mod(Path<?> path, PredicateNode.Modulus modulus) {
            long divisor = modulus.divisor();
            long remainder = modulus.remainder();
            if (divisor == (int) divisor && remainder == (int) remainder) {
                return cb.equal(cb.mod(path.as(Integer.class), (int) divisor), (int) remainder);
            }
            Expression<Long> mod = cb.function("mod", Long.class, path.as(Long.class), cb.literal(divisor));
            return cb.equal(mod, remainder);
        }

        /**
         * Comparison against a number the attribute type cannot hold: every stored value lies on
         * the same side of it.
         */
        private Predicate outOfRange(ComparisonOperator operator, Path<?> path, Number value) {
            boolean aboveMax = value.doubleValue() > 0;
            log.finer(() -> String.format("%s %s is out of range for %s", operator, value,
                    path.getJavaType().getSimpleName()));
            return switch (operator) {
                case NE -> cb.isNotNull(path);
                case LT, LTE -> aboveMax ? cb.isNotNull(path) : cb.disjunction();
                case GT, GTE -> aboveMax ? cb.disjunction() : cb.isNotNull(path);
                default -> cb.disjunction();
            };
        }

        private Predicate[] visitAll(List<PredicateNode> children) {
            return children.stream().map(child -> child.accept(this)).toArray(Predicate[]::new);
        }
    }

    @SuppressWarnings("unchecked")
    private static From<?, ?> correlate(Subquery<?> subquery, From<?, ?> from) {
        if (from instanceof Root<?> root) {
            return subquery.correlate((Root<Object>) root);
        }
        return subquery.correlate((Join<Object, Object>) from);
    }

    /**
     * @param number   compiled number
     * @param javaType attribute Java type
     * @return {@code false} if the attribute is an {@code int}, {@code short} or {@code byte}
     * and {@code number} lies outside its range
     */
    static boolean fits(Number number, Class<?> javaType) {
        long min;
        long max;
        if (javaType == Integer.class || javaType == int.class) {
            min = Integer.MIN_VALUE;
            max = Integer.MAX_VALUE;
        } else if (javaType == Short.class || javaType == short.class) {
            min = Short.MIN_VALUE;
            max = Short.MAX_VALUE;
        } else if (javaType == Byte.class || javaType == byte.class) {
            min = Byte.MIN_VALUE;
            max = Byte.MAX_VALUE;
        } else {
            return true;
        }
        double d = number.doubleValue();
        if (number instanceof Double || number instanceof Float || number instanceof BigDecimal) {
            return d >= min && d <= max;
        }
        if (number instanceof BigInteger integer) {
            return integer.bitLength() < 64 && integer.longValue() >= min && integer.longValue() <= max;
        }
        return number.longValue() >= min && number.longValue() <= max;
    }

    /**
     * Converts a compiled value to the Java type of the attribute it is compared with.
     *
     * @param value    compiled value
     * @param javaType attribute Java type
     * @return the narrowed value, or {@code value} itself when no conversion applies
     * @throws IllegalArgumentException if a text value names no constant of an enum attribute
     * @throws ArithmeticException      if a number lies outside the range of an integral attribute
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object narrow(Object value, Class<?> javaType) {
        if (value == null || javaType == null || javaType.isInstance(value)) {
            return value;
        }
        if (value instanceof Number number) {
            if (!fits(number, javaType)) {
                throw new ArithmeticException(number + " is out of range for " + javaType.getSimpleName());
            }
            if (javaType == Integer.class || javaType == int.class) {
                return number.intValue();
            }
            if (javaType == Long.class || javaType == long.class) {
                return number.longValue();
            }
            if (javaType == Short.class || javaType == short.class) {
                return number.shortValue();
            }
            if (javaType == Byte.class || javaType == byte.class) {
                return number.byteValue();
            }
            if (javaType == Double.class || javaType == double.class) {
                return number.doubleValue();
            }
            if (javaType == Float.class || javaType == float.class) {
                return number.floatValue();
            }
            if (javaType == BigDecimal.class) {
                return new BigDecimal(number.toString());
            }
            if (javaType == BigInteger.class) {
                return BigInteger.valueOf(number.longValue());
            }
        }
        if (value instanceof String text) {
            if (javaType.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) javaType, text);
            }
            if ((javaType == Character.class || javaType == char.class) && text.length() == 1) {
                return text.charAt(0);
            }
        }
        return value;
    }
}

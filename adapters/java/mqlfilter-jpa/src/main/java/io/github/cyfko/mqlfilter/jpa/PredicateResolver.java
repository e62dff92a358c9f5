package io.github.cyfko.mqlfilter.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred generator of a JPA Criteria {@link Predicate}.
 * <p>
 * A compiled filter is independent of any query; the JPA predicate is only built once the
 * caller provides the query context, so one resolver can be applied to many queries
 * (lists, counts, pages) over the same entity.
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Album> resolver = filters.compile(Album.class, document);
 *
 * CriteriaQuery<Album> query = cb.createQuery(Album.class);
 * Root<Album> root = query.from(Album.class);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> the entity type the predicate applies to
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for the given query context.
     *
     * @param root  root of the query, the entity being filtered
     * @param query query the predicate will be added to; used to create subqueries
     * @param cb    criteria builder
     * @return the predicate
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}

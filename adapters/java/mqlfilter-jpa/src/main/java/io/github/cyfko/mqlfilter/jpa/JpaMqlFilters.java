package io.github.cyfko.mqlfilter.jpa;

import io.github.cyfko.mqlfilter.core.api.FilterCompiler;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.config.CompileOptions;
import io.github.cyfko.mqlfilter.core.exception.InvalidMqlException;
import io.github.cyfko.mqlfilter.core.impl.BasicFilterCompiler;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.Metamodel;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point for filtering JPA entities with MongoDB-style documents.
 * <p>
 * Reads the persistence unit's metamodel as the schema, compiles documents with a
 * {@link FilterCompiler} and translates the result with a {@link JpaPredicateTranslator}.
 * Instances are thread-safe and meant to be shared.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * JpaMqlFilters filters = new JpaMqlFilters(entityManager);
 *
 * CriteriaBuilder cb = entityManager.getCriteriaBuilder();
 * CriteriaQuery<Album> query = cb.createQuery(Album.class);
 * Root<Album> root = query.from(Album.class);
 * query.where(cb.equal(root.get("artist").get("name"), "Alanis Morissette"));
 *
 * // AND-ed with the restriction above
 * filters.apply(query, root, cb, Map.of("tracks.playlists.name", "Grunge"), options);
 * List<Album> albums = entityManager.createQuery(query).getResultList();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaMqlFilters {

    private final JpaSchema schema;
    private final FilterCompiler compiler;
    private final JpaPredicateTranslator translator;

    /**
     * @param entityManager entity manager whose metamodel is used as schema
     */
    public JpaMqlFilters(EntityManager entityManager) {
        this(entityManager.getMetamodel());
    }

    /**
     * @param metamodel metamodel used as schema
     */
    public JpaMqlFilters(Metamodel metamodel) {
        this(metamodel, new BasicFilterCompiler());
    }

    /**
     * @param metamodel metamodel used as schema
     * @param compiler  compiler to use
     */
    public JpaMqlFilters(Metamodel metamodel, FilterCompiler compiler) {
        this.schema = new JpaSchema(metamodel);
        this.compiler = Objects.requireNonNull(compiler, "FilterCompiler cannot be null");
        this.translator = new JpaPredicateTranslator();
    }

    /**
     * @param entityClass managed entity class
     * @return the schema model of the entity
     */
    public SchemaModel schema(Class<?> entityClass) {
        return schema.model(entityClass);
    }

    /**
     * Compiles a document with default options.
     *
     * @see #compile(Class, Map, CompileOptions)
     */
    public <E> PredicateResolver<E> compile(Class<E> entityClass, Map<String, ?> document) throws InvalidMqlException {
        return compile(entityClass, document, CompileOptions.defaults());
    }

    /**
     * Compiles a document against an entity.
     *
     * @param entityClass managed entity class the document filters
     * @param document    filter document; {@code null} matches every row
     * @param options     compile options
     * @param <E>         entity type
     * @return a resolver producing the Criteria predicate
     * @throws InvalidMqlException if the document is invalid
     */
    public <E> PredicateResolver<E> compile(Class<E> entityClass, Map<String, ?> document, CompileOptions options)
            throws InvalidMqlException {
        PredicateNode predicate = compiler.compile(schema.model(entityClass), document, options);
        return translator.translate(predicate);
    }

    /**
     * Applies a document with default options.
     *
     * @see #apply(CriteriaQuery, Root, CriteriaBuilder, Map, CompileOptions)
     */
    public <T, E> CriteriaQuery<T> apply(CriteriaQuery<T> query, Root<E> root, CriteriaBuilder cb,
                                         Map<String, ?> document) throws InvalidMqlException {
        return apply(query, root, cb, document, CompileOptions.defaults());
    }

    /**
     * Compiles a document against the entity of {@code root} and AND-s it onto the query's
     * existing restriction.
     *
     * @param query    query to restrict
     * @param root     root of the filtered entity
     * @param cb       criteria builder
     * @param document filter document
     * @param options  compile options
     * @param <T>      query result type
     * @param <E>      entity type
     * @return {@code query}, restricted
     * @throws InvalidMqlException if the document is invalid
     */
    public <T, E> CriteriaQuery<T> apply(CriteriaQuery<T> query, Root<E> root, CriteriaBuilder cb,
                                         Map<String, ?> document, CompileOptions options) throws InvalidMqlException {
        Predicate predicate = compile(root.getModel().getJavaType(), document, options).resolve(root, query, cb);
        Predicate existing = query.getRestriction();
        return query.where(existing == null ? predicate : cb.and(existing, predicate));
    }
}

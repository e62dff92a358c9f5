package io.github.cyfko.mqlfilter.jpa;

import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.Metamodel;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schema view over a JPA {@link Metamodel}.
 * <p>
 * Hands out one {@link JpaSchemaModel} per managed type, so relations that point back to
 * an already visited entity (including self references) resolve to the same model
 * instance. Models are built on first access and cached for the lifetime of this object.
 * </p>
 *
 * <pre>{@code
 * JpaSchema schema = new JpaSchema(entityManager.getMetamodel());
 * SchemaModel album = schema.model(Album.class);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaSchema {

    private final Metamodel metamodel;
    private final Map<ManagedType<?>, JpaSchemaModel> models = new ConcurrentHashMap<>();

    /**
     * @param metamodel the persistence unit's metamodel
     */
    public JpaSchema(Metamodel metamodel) {
        this.metamodel = Objects.requireNonNull(metamodel, "Metamodel cannot be null");
    }

    /**
     * @param entityClass a managed class of the metamodel
     * @return the schema model of that class
     * @throws IllegalArgumentException if the class is not managed
     */
    public SchemaModel model(Class<?> entityClass) {
        return model(metamodel.managedType(entityClass));
    }

    JpaSchemaModel model(ManagedType<?> type) {
        return models.computeIfAbsent(type, t -> new JpaSchemaModel(t, this));
    }

    public Metamodel getMetamodel() {
        return metamodel;
    }
}

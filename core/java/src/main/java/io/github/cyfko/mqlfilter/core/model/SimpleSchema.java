package io.github.cyfko.mqlfilter.core.model;

import io.github.cyfko.mqlfilter.core.spi.Cardinality;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.spi.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * In-memory set of {@link SchemaModel}s, for applications without ORM metadata and for tests.
 * <p>
 * Relations name their target model; targets are resolved when the schema is built, so
 * models may reference each other in any order, and themselves.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SimpleSchema schema = SimpleSchema.builder()
 *     .model("Album", m -> m
 *         .scalar("album_id", ValueType.INT)
 *         .scalar("title", ValueType.TEXT)
 *         .relation("tracks", "Track", Cardinality.MANY))
 *     .model("Track", m -> m
 *         .scalar("track_id", ValueType.INT)
 *         .scalar("name", ValueType.TEXT)
 *         .relation("album", "Album", Cardinality.ONE))
 *     .build();
 *
 * SchemaModel album = schema.model("Album");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SimpleSchema {

    private final Map<String, Model> models;

    private SimpleSchema(Map<String, Model> models) {
        this.models = Collections.unmodifiableMap(models);
    }

    /**
     * @param name model name
     * @return the model
     * @throws IllegalArgumentException if the schema declares no such model
     */
    public SchemaModel model(String name) {
        Model model = models.get(name);
        if (model == null) {
            throw new IllegalArgumentException("Unknown model: " + name);
        }
        return model;
    }

    /**
     * @return names of the declared models, in declaration order
     */
    public Set<String> modelNames() {
        return models.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Model of a {@link SimpleSchema}. Fields keep their declaration order.
     */
    private static final class Model implements SchemaModel {
        private final String name;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

        private Model(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<FieldDescriptor> field(String fieldName) {
            return Optional.ofNullable(fields.get(fieldName));
        }

        @Override
        public String toString() {
            return "SimpleSchema.Model[" + name + ", fields=" + fields.keySet() + "]";
        }
    }

    /**
     * Collects the fields of one model.
     */
    public static final class ModelBuilder {
        private final Map<String, ValueType> _scalars = new LinkedHashMap<>();
        private final Map<String, Map.Entry<String, Cardinality>> _relations = new LinkedHashMap<>();

        private ModelBuilder() {}

        public ModelBuilder scalar(String name, ValueType type) {
            requireUnique(name);
            _scalars.put(name, type);
            return this;
        }

        public ModelBuilder relation(String name, String targetModel, Cardinality cardinality) {
            requireUnique(name);
            _relations.put(name, Map.entry(targetModel, cardinality));
            return this;
        }

        private void requireUnique(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name is required");
            }
            if (_scalars.containsKey(name) || _relations.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate field: " + name);
            }
        }
    }

    public static final class Builder {
        private final Map<String, ModelBuilder> _models = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Declares a model.
         *
         * @param name       model name
         * @param definition callback declaring the model's fields
         * @return this builder
         */
        public Builder model(String name, Consumer<ModelBuilder> definition) {
            if (_models.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate model: " + name);
            }
            ModelBuilder modelBuilder = new ModelBuilder();
            definition.accept(modelBuilder);
            _models.put(name, modelBuilder);
            return this;
        }

        /**
         * @return the schema
         * @throws IllegalStateException if a relation targets an undeclared model
         */
        public SimpleSchema build() {
            Map<String, Model> models = new LinkedHashMap<>();
            _models.keySet().forEach(name -> models.put(name, new Model(name)));

            _models.forEach((name, definition) -> {
                Model model = models.get(name);
                definition._scalars.forEach((field, type) ->
                        model.fields.put(field, new FieldDescriptor.Scalar(field, type)));
                definition._relations.forEach((field, target) -> {
                    Model targetModel = models.get(target.getKey());
                    if (targetModel == null) {
                        throw new IllegalStateException(String.format(
                                "Relation %s.%s targets undeclared model %s", name, field, target.getKey()));
                    }
                    model.fields.put(field, new FieldDescriptor.Relation(field, targetModel, target.getValue()));
                });
            });
            return new SimpleSchema(models);
        }
    }
}

package io.github.cyfko.mqlfilter.jpa;

import io.github.cyfko.mqlfilter.core.spi.Cardinality;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.spi.ValueType;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.ManagedType;
import jakarta.persistence.metamodel.PluralAttribute;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link SchemaModel} of one JPA managed type.
 * <p>
 * Attributes are mapped on first lookup:
 * </p>
 * <ul>
 *   <li>basic attributes become {@link FieldDescriptor.Scalar}s typed after their Java type
 *   (integral types: {@code INT}, {@code String}/{@code char}/enums: {@code TEXT}, {@code Boolean}: {@code BOOL},
 *   {@code LocalDate}: {@code DATE}, {@code LocalDateTime}: {@code DATETIME}, {@code LocalTime}: {@code TIME},
 *   floating point and {@code BigDecimal}: {@code FLOAT})</li>
 *   <li>{@code ONE_TO_ONE} / {@code MANY_TO_ONE} associations become {@link Cardinality#ONE} relations</li>
 *   <li>{@code ONE_TO_MANY} / {@code MANY_TO_MANY} associations become {@link Cardinality#MANY} relations</li>
 * </ul>
 * <p>
 * Any other attribute (embeddables, element collections, binary columns...) is left out and
 * therefore cannot be filtered on.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaSchemaModel implements SchemaModel {

    private static final Logger log = Logger.getLogger(JpaSchemaModel.class.getName());

    private final ManagedType<?> type;
    private final JpaSchema schema;
    private volatile Map<String, FieldDescriptor> fields;

    JpaSchemaModel(ManagedType<?> type, JpaSchema schema) {
        this.type = type;
        this.schema = schema;
    }

    @Override
    public String name() {
        if (type instanceof EntityType<?> entity) {
            return entity.getName();
        }
        return type.getJavaType().getSimpleName();
    }

    @Override
    public Optional<FieldDescriptor> field(String fieldName) {
        return Optional.ofNullable(fields().get(fieldName));
    }

    /**
     * @return the managed type this model reads
     */
    public ManagedType<?> getManagedType() {
        return type;
    }

    private Map<String, FieldDescriptor> fields() {
        Map<String, FieldDescriptor> result = fields;
        if (result == null) {
            synchronized (this) {
                result = fields;
                if (result == null) {
                    result = mapAttributes();
                    fields = result;
                }
            }
        }
        return result;
    }

    private Map<String, FieldDescriptor> mapAttributes() {
        Map<String, FieldDescriptor> mapped = new LinkedHashMap<>();
        for (Attribute<?, ?> attribute : type.getAttributes()) {
            FieldDescriptor descriptor = describe(attribute);
            if (descriptor == null) {
                log.finer(() -> String.format("Skipping attribute %s.%s (%s)",
                        name(), attribute.getName(), attribute.getPersistentAttributeType()));
            } else {
                mapped.put(attribute.getName(), descriptor);
            }
        }
        return Collections.unmodifiableMap(mapped);
    }

    private FieldDescriptor describe(Attribute<?, ?> attribute) {
        switch (attribute.getPersistentAttributeType()) {
            case BASIC -> {
                ValueType valueType = valueTypeOf(attribute.getJavaType());
                return valueType == null ? null : new FieldDescriptor.Scalar(attribute.getName(), valueType);
            }
            case ONE_TO_ONE, MANY_TO_ONE -> {
                Type<?> target = attribute instanceof SingularAttribute<?, ?> singular ? singular.getType() : null;
                return relation(attribute.getName(), target, Cardinality.ONE);
            }
            case ONE_TO_MANY, MANY_TO_MANY -> {
                Type<?> target = attribute instanceof PluralAttribute<?, ?, ?> plural ? plural.getElementType() : null;
                return relation(attribute.getName(), target, Cardinality.MANY);
            }
            default -> {
                return null;
            }
        }
    }

    private FieldDescriptor relation(String name, Type<?> target, Cardinality cardinality) {
        if (!(target instanceof ManagedType<?> managed)) {
            return null;
        }
        return new FieldDescriptor.Relation(name, schema.model(managed), cardinality);
    }

    /**
     * Value type used for a basic attribute of the given Java type.
     *
     * @param javaType attribute Java type
     * @return the value type, or {@code null} if the type cannot be filtered on
     */
    static ValueType valueTypeOf(Class<?> javaType) {
        if (javaType == null) {
            return null;
        }
        if (javaType == Long.class || javaType == long.class
                || javaType == Integer.class || javaType == int.class
                || javaType == Short.class || javaType == short.class
                || javaType == Byte.class || javaType == byte.class
                || javaType == BigInteger.class) {
            return ValueType.INT;
        }
        if (javaType == String.class || javaType == Character.class || javaType == char.class || javaType.isEnum()) {
            return ValueType.TEXT;
        }
        if (javaType == Boolean.class || javaType == boolean.class) {
            return ValueType.BOOL;
        }
        if (javaType == Double.class || javaType == double.class
                || javaType == Float.class || javaType == float.class
                || javaType == BigDecimal.class) {
            return ValueType.FLOAT;
        }
        if (javaType == LocalDate.class) {
            return ValueType.DATE;
        }
        if (javaType == LocalDateTime.class) {
            return ValueType.DATETIME;
        }
        if (javaType == LocalTime.class) {
            return ValueType.TIME;
        }
        return null;
    }

    @Override
    public String toString() {
        return "JpaSchemaModel[" + name() + "]";
    }
}

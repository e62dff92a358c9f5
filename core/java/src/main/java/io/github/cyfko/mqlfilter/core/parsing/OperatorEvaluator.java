package io.github.cyfko.mqlfilter.core.parsing;

import io.github.cyfko.mqlfilter.core.api.ComparisonOperator;
import io.github.cyfko.mqlfilter.core.api.MqlOperator;
import io.github.cyfko.mqlfilter.core.api.PredicateNode;
import io.github.cyfko.mqlfilter.core.exception.MqlErrorCode;
import io.github.cyfko.mqlfilter.core.exception.MqlFieldException;
import io.github.cyfko.mqlfilter.core.exception.TypeConversionException;
import io.github.cyfko.mqlfilter.core.spi.FieldDescriptor;
import io.github.cyfko.mqlfilter.core.spi.MessageFormatter;
import io.github.cyfko.mqlfilter.core.spi.ValueType;
import io.github.cyfko.mqlfilter.core.utils.TypeCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns one {@code (operator, field, value)} triple into a predicate leaf.
 * <p>
 * Operand values are coerced with {@link TypeCoercion} to the field's {@link ValueType}.
 * Operators without a primitive counterpart are rewritten: {@code $nin} becomes
 * {@code NOT(IN)}, {@code $exists} becomes a null test on scalars and an existential
 * scope on relations.
 * </p>
 *
 * <h2>Operator Mapping</h2>
 * <table border="1">
 *   <caption>Filter operator to predicate leaf</caption>
 *   <tr><th>Operator</th><th>Leaf</th></tr>
 *   <tr><td>$eq $ne $lt $lte $gt $gte</td><td>Comparison with the coerced value</td></tr>
 *   <tr><td>$like</td><td>Comparison LIKE {@code %value%}</td></tr>
 *   <tr><td>$in / $nin</td><td>Comparison IN / Not(IN)</td></tr>
 *   <tr><td>$mod</td><td>Comparison MOD with a {@link PredicateNode.Modulus}</td></tr>
 *   <tr><td>$exists</td><td>IS_NOT_NULL / IS_NULL, or Exists / Not(Exists) on a relation</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OperatorEvaluator {

    static final String INVALID_OP_MESSAGE = "Invalid operator.";
    static final String IN_NOT_LIST_MESSAGE = "$in and $nin values must be a list.";
    static final String MOD_NOT_INT_FIELD_MESSAGE = "$mod may only be used on integer fields.";
    static final String MOD_NOT_PAIR_MESSAGE = "$mod value must be list of two integers.";
    static final String MOD_NON_INT_MESSAGE = "Non int $mod value supplied.";
    static final String MOD_ZERO_DIVISOR_MESSAGE = "$mod divisor must not be zero.";
    static final String MOD_RANGE_MESSAGE = "$mod values must fit in a 64-bit integer.";
    static final String CONVERSION_MESSAGE = "Unable to convert provided data to the proper type for this field.";
    static final String RELATION_COMP_MESSAGE = "Relationships can't be checked for equality.";

    private final MessageFormatter messageFormatter;

    public OperatorEvaluator(MessageFormatter messageFormatter) {
        this.messageFormatter = Objects.requireNonNull(messageFormatter, "messageFormatter");
    }

    /**
     * Builds the predicate for an operator applied to a field.
     *
     * @param op       operator; {@code null} stands for an unknown token
     * @param field    descriptor of the field, a relation only for {@code $exists}
     * @param rawValue operand as found in the filter document
     * @param dataKey  dotted path of the field, for error reporting
     * @return the predicate leaf
     * @throws MqlFieldException if the operator or the value is invalid for the field
     */
    public PredicateNode evaluate(MqlOperator op, FieldDescriptor field, Object rawValue, String dataKey) {
        if (op == null || !op.isFieldOperator()) {
            throw fieldError(dataKey, rawValue, op, INVALID_OP_MESSAGE, MqlErrorCode.INVALID_OP, null);
        }
        if (field instanceof FieldDescriptor.Relation relation) {
            if (op != MqlOperator.EXISTS) {
                throw fieldError(dataKey, rawValue, op, RELATION_COMP_MESSAGE, MqlErrorCode.INVALID_RELATION_COMP, null);
            }
            return relationExists(relation, rawValue, dataKey);
        }

        FieldDescriptor.Scalar scalar = (FieldDescriptor.Scalar) field;
        try {
            return switch (op) {
                case EQ -> compare(scalar, ComparisonOperator.EQ, rawValue);
                case NE -> compare(scalar, ComparisonOperator.NE, rawValue);
                case LT -> compare(scalar, ComparisonOperator.LT, rawValue);
                case LTE -> compare(scalar, ComparisonOperator.LTE, rawValue);
                case GT -> compare(scalar, ComparisonOperator.GT, rawValue);
                case GTE -> compare(scalar, ComparisonOperator.GTE, rawValue);
                case LIKE -> PredicateNode.comparison(scalar.name(), scalar.type(),
                        ComparisonOperator.LIKE, "%" + rawValue + "%");
                case IN -> in(scalar, rawValue, dataKey, op);
                case NIN -> PredicateNode.not(in(scalar, rawValue, dataKey, op));
                case MOD -> mod(scalar, rawValue, dataKey);
                case EXISTS -> PredicateNode.comparison(scalar.name(), scalar.type(),
                        toExistsFlag(rawValue) ? ComparisonOperator.IS_NOT_NULL : ComparisonOperator.IS_NULL, null);
                default -> throw fieldError(dataKey, rawValue, op, INVALID_OP_MESSAGE, MqlErrorCode.INVALID_OP, null);
            };
        } catch (TypeConversionException e) {
            throw fieldError(dataKey, rawValue, op, CONVERSION_MESSAGE, MqlErrorCode.DATA_CONVERSION_ERROR, e);
        }
    }

    /**
     * {@code Exists} over the whole relation when the flag is true, its negation otherwise.
     */
    private PredicateNode relationExists(FieldDescriptor.Relation relation, Object rawValue, String dataKey) {
        boolean exists;
        try {
            exists = toExistsFlag(rawValue);
        } catch (TypeConversionException e) {
            throw fieldError(dataKey, rawValue, MqlOperator.EXISTS, CONVERSION_MESSAGE, MqlErrorCode.DATA_CONVERSION_ERROR, e);
        }
        PredicateNode scope = PredicateNode.exists(relation.name(), relation.cardinality(), PredicateNode.alwaysTrue());
        return exists ? scope : PredicateNode.not(scope);
    }

    private static PredicateNode compare(FieldDescriptor.Scalar scalar, ComparisonOperator operator, Object rawValue) {
        return PredicateNode.comparison(scalar.name(), scalar.type(), operator,
                TypeCoercion.coerce(rawValue, scalar.type()));
    }

    private PredicateNode in(FieldDescriptor.Scalar scalar, Object rawValue, String dataKey, MqlOperator op) {
        if (!(rawValue instanceof List<?> values)) {
            throw fieldError(dataKey, rawValue, op, IN_NOT_LIST_MESSAGE, MqlErrorCode.INVALID_IN_COMP, null);
        }
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(TypeCoercion.coerce(value, scalar.type()));
        }
        return PredicateNode.comparison(scalar.name(), scalar.type(), ComparisonOperator.IN, converted);
    }

    private PredicateNode mod(FieldDescriptor.Scalar scalar, Object rawValue, String dataKey) {
        if (scalar.type() != ValueType.INT) {
            throw fieldError(dataKey, rawValue, MqlOperator.MOD, MOD_NOT_INT_FIELD_MESSAGE, MqlErrorCode.INVALID_OP, null);
        }
        if (!(rawValue instanceof List<?> operands) || operands.size() != 2) {
            throw fieldError(dataKey, rawValue, MqlOperator.MOD, MOD_NOT_PAIR_MESSAGE, MqlErrorCode.INVALID_MOD_VALUES, null);
        }
        Long divisor;
        Long remainder;
        try {
            divisor = toWholeNumber(operands.get(0));
            remainder = toWholeNumber(operands.get(1));
        } catch (ArithmeticException e) {
            throw fieldError(dataKey, rawValue, MqlOperator.MOD, MOD_RANGE_MESSAGE, MqlErrorCode.INVALID_MOD_VALUES, e);
        }
        if (divisor == null || remainder == null) {
            throw fieldError(dataKey, rawValue, MqlOperator.MOD, MOD_NON_INT_MESSAGE, MqlErrorCode.INVALID_MOD_VALUES, null);
        }
        if (divisor == 0L) {
            throw fieldError(dataKey, rawValue, MqlOperator.MOD, MOD_ZERO_DIVISOR_MESSAGE, MqlErrorCode.INVALID_MOD_VALUES, null);
        }
        return PredicateNode.comparison(scalar.name(), scalar.type(), ComparisonOperator.MOD,
                new PredicateNode.Modulus(divisor, remainder));
    }

    /**
     * Integral numbers, and floating point numbers without a fractional part, as {@code long};
     * {@code null} for anything else.
     *
     * @throws ArithmeticException if the number lies outside the {@code long} range
     */
    private static Long toWholeNumber(Object value) {
        if (TypeCoercion.isIntegral(value)) {
            return TypeCoercion.toLongExact((Number) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d)) {
                return TypeCoercion.toLongExact(d);
            }
        }
        return null;
    }

    private static boolean toExistsFlag(Object rawValue) {
        Object flag = TypeCoercion.coerce(rawValue, ValueType.BOOL);
        return Boolean.TRUE.equals(flag);
    }

    private MqlFieldException fieldError(String dataKey, Object filter, MqlOperator op, String template,
                                         MqlErrorCode code, Throwable cause) {
        String token = op == null ? null : op.getToken();
        return new MqlFieldException(dataKey, filter, token, messageFormatter.format(template), code, cause);
    }
}

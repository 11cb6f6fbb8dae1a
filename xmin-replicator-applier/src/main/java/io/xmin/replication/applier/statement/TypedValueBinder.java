package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.model.value.TypedValue;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * Binds {@link TypedValue}s to the {@code CAST(? AS type)} placeholders of generated statements.
 * The cast to the declared type lets text forms reach types the driver has no setter for.
 */
public final class TypedValueBinder {
    private static final String TEXT_ARRAY_TYPE = "text";
    private static final String BOOLEAN_ARRAY_TYPE = "bool";
    private static final String INTEGER_ARRAY_TYPE = "int8";
    private static final String BINARY_ARRAY_TYPE = "bytea";

    private TypedValueBinder() {
    }

    public static void bind(Connection connection, PreparedStatement statement, int index, ColumnSchema column, TypedValue value) throws SQLException {
        switch (value.getKind()) {
            case NULL:
                statement.setNull(index, Types.NULL);
                break;
            case BOOLEAN:
                statement.setBoolean(index, value.asBoolean());
                break;
            case INTEGER:
                statement.setLong(index, value.asLong());
                break;
            case DECIMAL:
                statement.setBigDecimal(index, value.asDecimal());
                break;
            case TEXT:
                statement.setString(index, value.asText());
                break;
            case BINARY:
                statement.setBytes(index, value.asBytes());
                break;
            case TIMESTAMP:
                statement.setObject(index, value.asTemporal());
                break;
            case UUID:
                statement.setObject(index, value.asUuid());
                break;
            case JSON:
                statement.setString(index, value.asJson());
                break;
            case ARRAY:
                if (!column.isArray()) {
                    throw new TypeConversionException(String.format("array value for scalar column %s", column.getName()));
                }

                Array array = connection.createArrayOf(TypedValueBinder.arrayType(value.getElementKind()), TypedValueBinder.toElements(value));
                statement.setArray(index, array);
                break;
            default:
                throw new TypeConversionException(String.format("cannot bind %s to column %s", value.getKind(), column.getName()));
        }
    }

    /**
     * Type name handed to {@link Connection#createArrayOf(String, Object[])}. Everything without an exact
     * driver encoding travels as text and is converted by the statement's cast.
     */
    static String arrayType(TypedValue.Kind elementKind) {
        switch (elementKind) {
            case BOOLEAN:
                return TypedValueBinder.BOOLEAN_ARRAY_TYPE;
            case INTEGER:
                return TypedValueBinder.INTEGER_ARRAY_TYPE;
            case BINARY:
                return TypedValueBinder.BINARY_ARRAY_TYPE;
            default:
                return TypedValueBinder.TEXT_ARRAY_TYPE;
        }
    }

    /**
     * Nested {@code Object[]} per dimension, elements converted for {@link #arrayType(TypedValue.Kind)}.
     * Binary elements use {@code byte[][]} (one more level per dimension), the only shape the driver encodes as bytea.
     */
    static Object[] toElements(TypedValue array) {
        List<TypedValue> values = array.asArray();
        Object[] elements = TypedValueBinder.newElements(array, values.size());

        for (int index = 0; index < values.size(); index++) {
            try {
                elements[index] = TypedValueBinder.toElement(values.get(index), array.getElementKind());
            } catch (ArrayStoreException exception) {
                throw new TypeConversionException(String.format("bytea array with mixed dimensions: %s", array), exception);
            }
        }

        return elements;
    }

    private static Object[] newElements(TypedValue array, int size) {
        if (array.getElementKind() != TypedValue.Kind.BINARY) {
            return new Object[size];
        }

        Class<?> componentType = byte[].class;

        for (int dimension = 1; dimension < TypedValueBinder.dimensions(array); dimension++) {
            componentType = java.lang.reflect.Array.newInstance(componentType, 0).getClass();
        }

        return (Object[]) java.lang.reflect.Array.newInstance(componentType, size);
    }

    private static int dimensions(TypedValue array) {
        int nested = 0;

        for (TypedValue value : array.asArray()) {
            if (value.getKind() == TypedValue.Kind.ARRAY) {
                nested = Math.max(nested, TypedValueBinder.dimensions(value));
            }
        }

        return nested + 1;
    }

    private static Object toElement(TypedValue value, TypedValue.Kind elementKind) {
        switch (value.getKind()) {
            case NULL:
                return null;
            case ARRAY:
                return TypedValueBinder.toElements(value);
            case BOOLEAN:
                return value.asBoolean();
            case INTEGER:
                return value.asLong();
            case BINARY:
                return value.asBytes();
            case DECIMAL:
                return ((BigDecimal) value.getValue()).toPlainString();
            default:
                if (elementKind == TypedValue.Kind.BOOLEAN || elementKind == TypedValue.Kind.INTEGER || elementKind == TypedValue.Kind.BINARY) {
                    throw new TypeConversionException(String.format("%s element in array of %s", value.getKind(), elementKind));
                }

                return String.valueOf(value.getValue());
        }
    }
}

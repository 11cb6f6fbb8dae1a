package io.xmin.replication.supplier.value;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.model.value.TypedValue;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Maps JDBC column values to {@link TypedValue}, driven by the column's element type.
 * Numerics are read from their text form so no value passes through a double.
 */
public final class TypedValueReader {
    private static final String NAN = "NaN";
    private static final String POSITIVE_INFINITY = "Infinity";
    private static final String NEGATIVE_INFINITY = "-Infinity";

    private TypedValueReader() {
    }

    public static TypedValue read(ResultSet resultSet, int index, ColumnSchema column) throws SQLException {
        if (column.isArray()) {
            Array array = resultSet.getArray(index);

            if (array == null) {
                return TypedValue.nullValue();
            }

            try {
                return TypedValueReader.fromArray((Object[]) array.getArray(), column.getElementType());
            } finally {
                array.free();
            }
        }

        ElementType elementType = column.getElementType();

        switch (elementType.getKind()) {
            case BOOLEAN:
                boolean booleanValue = resultSet.getBoolean(index);
                return resultSet.wasNull() ? TypedValue.nullValue() : TypedValue.bool(booleanValue);
            case INTEGER:
                long longValue = resultSet.getLong(index);
                return resultSet.wasNull() ? TypedValue.nullValue() : TypedValue.integer(longValue);
            case DECIMAL:
                return TypedValueReader.decimal(resultSet.getString(index));
            case TEXT:
                return TypedValue.text(resultSet.getString(index));
            case BINARY:
                return TypedValue.binary(resultSet.getBytes(index));
            case TIMESTAMP:
                return TypedValue.timestamp(TypedValueReader.temporal(resultSet, index, elementType));
            case UUID:
                return TypedValue.uuid(resultSet.getObject(index, UUID.class));
            case JSON:
                return TypedValue.json(resultSet.getString(index));
            default:
                throw new TypeConversionException(String.format("cannot read column %s of type %s", column.getName(), column.getDeclaredType()));
        }
    }

    /**
     * Converts the elements of {@link Array#getArray()}; nested {@code Object[]} are further dimensions.
     */
    public static TypedValue fromArray(Object[] elements, ElementType elementType) {
        if (elements == null) {
            return TypedValue.nullValue();
        }

        List<TypedValue> values = new ArrayList<>(elements.length);

        for (Object element : elements) {
            if (element instanceof Object[]) {
                values.add(TypedValueReader.fromArray((Object[]) element, elementType));
            } else {
                values.add(TypedValueReader.fromObject(element, elementType));
            }
        }

        return TypedValue.array(elementType.getKind(), values);
    }

    public static TypedValue fromObject(Object value, ElementType elementType) {
        if (value == null) {
            return TypedValue.nullValue();
        }

        switch (elementType.getKind()) {
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return TypedValue.bool((Boolean) value);
                }
                break;
            case INTEGER:
                if (value instanceof Number) {
                    return TypedValue.integer(((Number) value).longValue());
                }
                break;
            case DECIMAL:
                if (value instanceof BigDecimal) {
                    return TypedValue.decimal((BigDecimal) value);
                }
                if (value instanceof Number) {
                    return TypedValueReader.decimal(value.toString());
                }
                break;
            case TEXT:
                return TypedValue.text(value.toString());
            case BINARY:
                if (value instanceof byte[]) {
                    return TypedValue.binary((byte[]) value);
                }
                break;
            case TIMESTAMP:
                return TypedValue.timestamp(TypedValueReader.temporal(value, elementType));
            case UUID:
                if (value instanceof UUID) {
                    return TypedValue.uuid((UUID) value);
                }
                return TypedValue.uuid(UUID.fromString(value.toString()));
            case JSON:
                return TypedValue.json(value.toString());
            default:
                break;
        }

        throw new TypeConversionException(String.format(
                "cannot convert %s to %s", value.getClass().getName(), elementType.getCode()
        ));
    }

    /**
     * Parses the server's text form. Special float values have no decimal form and stay text.
     */
    public static TypedValue decimal(String text) {
        if (text == null) {
            return TypedValue.nullValue();
        }

        switch (text) {
            case TypedValueReader.NAN:
            case TypedValueReader.POSITIVE_INFINITY:
            case TypedValueReader.NEGATIVE_INFINITY:
                return TypedValue.text(text);
            default:
                try {
                    return TypedValue.decimal(new BigDecimal(text));
                } catch (NumberFormatException exception) {
                    throw new TypeConversionException(String.format("invalid numeric value: %s", text), exception);
                }
        }
    }

    private static Temporal temporal(ResultSet resultSet, int index, ElementType elementType) throws SQLException {
        switch (elementType) {
            case DATE:
                return resultSet.getObject(index, LocalDate.class);
            case TIME:
                return resultSet.getObject(index, LocalTime.class);
            case TIMESTAMP:
                return resultSet.getObject(index, LocalDateTime.class);
            case TIMESTAMPTZ:
                return resultSet.getObject(index, OffsetDateTime.class);
            default:
                throw new TypeConversionException(String.format("not a temporal type: %s", elementType.getCode()));
        }
    }

    private static Temporal temporal(Object value, ElementType elementType) {
        if (value instanceof Temporal) {
            return (Temporal) value;
        }

        if (value instanceof Timestamp) {
            Timestamp timestamp = (Timestamp) value;
            return (elementType == ElementType.TIMESTAMPTZ)
                    ? timestamp.toInstant().atOffset(ZoneOffset.UTC)
                    : timestamp.toLocalDateTime();
        }

        if (value instanceof Date) {
            return ((Date) value).toLocalDate();
        }

        if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        }

        throw new TypeConversionException(String.format(
                "cannot convert %s to %s", value.getClass().getName(), elementType.getCode()
        ));
    }
}

package io.xmin.replication.model.value;

import java.io.Serializable;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single column value with its variant fixed by the declared column type.
 *
 * <p>Instances are created only through the static factories, which keeps the set of variants closed.
 * Arrays carry the kind of their elements; nested arrays of the same element kind represent
 * multi-dimensional values.
 */
public final class TypedValue implements Serializable {

    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        DECIMAL,
        TEXT,
        BINARY,
        TIMESTAMP,
        UUID,
        JSON,
        ARRAY
    }

    private static final TypedValue NULL = new TypedValue(Kind.NULL, null, null);

    private static final int FIXED_WIDTH_ESTIMATE = 8;
    private static final int UUID_ESTIMATE = 16;
    private static final int TIMESTAMP_ESTIMATE = 32;

    private final Kind kind;
    private final Object value;
    private final Kind elementKind;

    private TypedValue(Kind kind, Object value, Kind elementKind) {
        this.kind = kind;
        this.value = value;
        this.elementKind = elementKind;
    }

    public static TypedValue nullValue() {
        return TypedValue.NULL;
    }

    public static TypedValue bool(boolean value) {
        return new TypedValue(Kind.BOOLEAN, value, null);
    }

    public static TypedValue integer(long value) {
        return new TypedValue(Kind.INTEGER, value, null);
    }

    public static TypedValue decimal(BigDecimal value) {
        return (value != null) ? new TypedValue(Kind.DECIMAL, value, null) : TypedValue.NULL;
    }

    public static TypedValue text(String value) {
        return (value != null) ? new TypedValue(Kind.TEXT, value, null) : TypedValue.NULL;
    }

    public static TypedValue binary(byte[] value) {
        return (value != null) ? new TypedValue(Kind.BINARY, value.clone(), null) : TypedValue.NULL;
    }

    public static TypedValue timestamp(Temporal value) {
        return (value != null) ? new TypedValue(Kind.TIMESTAMP, value, null) : TypedValue.NULL;
    }

    public static TypedValue uuid(UUID value) {
        return (value != null) ? new TypedValue(Kind.UUID, value, null) : TypedValue.NULL;
    }

    public static TypedValue json(String document) {
        return (document != null) ? new TypedValue(Kind.JSON, document, null) : TypedValue.NULL;
    }

    public static TypedValue array(Kind elementKind, List<TypedValue> elements) {
        Objects.requireNonNull(elementKind, "array element kind required");

        if (elementKind == Kind.ARRAY || elementKind == Kind.NULL) {
            throw new TypeConversionException(String.format("invalid array element kind: %s", elementKind));
        }

        if (elements == null) {
            return TypedValue.NULL;
        }

        for (TypedValue element : elements) {
            if (element.kind == Kind.ARRAY) {
                if (element.elementKind != elementKind) {
                    throw new TypeConversionException(String.format(
                            "nested array of %s inside array of %s", element.elementKind, elementKind
                    ));
                }
            } else if (element.kind != Kind.NULL && element.kind != elementKind && !TypedValue.isSpecialFloat(elementKind, element)) {
                throw new TypeConversionException(String.format(
                        "array of %s cannot hold %s", elementKind, element.kind
                ));
            }
        }

        return new TypedValue(Kind.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)), elementKind);
    }

    // NaN and the infinities of float columns have no decimal form and travel as text
    private static boolean isSpecialFloat(Kind elementKind, TypedValue element) {
        return elementKind == Kind.DECIMAL && element.kind == Kind.TEXT;
    }

    public Kind getKind() {
        return this.kind;
    }

    public Kind getElementKind() {
        return this.elementKind;
    }

    public boolean isNull() {
        return this.kind == Kind.NULL;
    }

    public boolean asBoolean() {
        return (Boolean) this.expect(Kind.BOOLEAN);
    }

    public long asLong() {
        return (Long) this.expect(Kind.INTEGER);
    }

    public BigDecimal asDecimal() {
        return (BigDecimal) this.expect(Kind.DECIMAL);
    }

    public String asText() {
        return (String) this.expect(Kind.TEXT);
    }

    public byte[] asBytes() {
        return ((byte[]) this.expect(Kind.BINARY)).clone();
    }

    public Temporal asTemporal() {
        return (Temporal) this.expect(Kind.TIMESTAMP);
    }

    public UUID asUuid() {
        return (UUID) this.expect(Kind.UUID);
    }

    public String asJson() {
        return (String) this.expect(Kind.JSON);
    }

    @SuppressWarnings("unchecked")
    public List<TypedValue> asArray() {
        return (List<TypedValue>) this.expect(Kind.ARRAY);
    }

    public Object getValue() {
        return this.value;
    }

    public long estimatedSize() {
        switch (this.kind) {
            case NULL:
                return 4;
            case BOOLEAN:
                return 1;
            case INTEGER:
                return TypedValue.FIXED_WIDTH_ESTIMATE;
            case DECIMAL:
                return ((BigDecimal) this.value).toString().length();
            case TEXT:
            case JSON:
                return ((String) this.value).getBytes(StandardCharsets.UTF_8).length;
            case BINARY:
                return ((byte[]) this.value).length;
            case TIMESTAMP:
                return TypedValue.TIMESTAMP_ESTIMATE;
            case UUID:
                return TypedValue.UUID_ESTIMATE;
            case ARRAY:
                long size = 0;
                for (TypedValue element : this.asArray()) {
                    size += element.estimatedSize() + 1;
                }
                return size;
            default:
                throw new IllegalStateException(String.format("unknown kind %s", this.kind));
        }
    }

    private Object expect(Kind expected) {
        if (this.kind != expected) {
            throw new TypeConversionException(String.format("expected %s value but was %s", expected, this.kind));
        }

        return this.value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof TypedValue)) {
            return false;
        }

        TypedValue typedValue = (TypedValue) other;

        if (this.kind != typedValue.kind || this.elementKind != typedValue.elementKind) {
            return false;
        }

        switch (this.kind) {
            case NULL:
                return true;
            case DECIMAL:
                return ((BigDecimal) this.value).compareTo((BigDecimal) typedValue.value) == 0;
            case BINARY:
                return Arrays.equals((byte[]) this.value, (byte[]) typedValue.value);
            default:
                return Objects.equals(this.value, typedValue.value);
        }
    }

    @Override
    public int hashCode() {
        switch (this.kind) {
            case NULL:
                return 0;
            case DECIMAL:
                BigDecimal decimal = (BigDecimal) this.value;
                return decimal.signum() == 0 ? 0 : decimal.stripTrailingZeros().hashCode();
            case BINARY:
                return Arrays.hashCode((byte[]) this.value);
            default:
                return Objects.hash(this.kind, this.elementKind, this.value);
        }
    }

    @Override
    public String toString() {
        switch (this.kind) {
            case NULL:
                return "NULL";
            case BINARY:
                return String.format("bytea(%d)", ((byte[]) this.value).length);
            case TEXT:
            case JSON:
                return String.format("'%s'", this.value);
            default:
                return String.valueOf(this.value);
        }
    }
}

package io.xmin.replication.model.schema;

import io.xmin.replication.model.value.TypeConversionException;
import io.xmin.replication.model.value.TypedValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed mapping from PostgreSQL type names ({@code pg_type.typname}) to {@link TypedValue.Kind}.
 *
 * <p>For array columns the element type name is looked up, never the array type itself, so
 * {@code _numeric} resolves through {@code numeric}. Names outside this table are rejected.
 */
public enum ElementType {

    BOOL(TypedValue.Kind.BOOLEAN, "bool"),

    INT2(TypedValue.Kind.INTEGER, "int2"),
    INT4(TypedValue.Kind.INTEGER, "int4"),
    INT8(TypedValue.Kind.INTEGER, "int8"),
    OID(TypedValue.Kind.INTEGER, "oid"),

    NUMERIC(TypedValue.Kind.DECIMAL, "numeric"),
    FLOAT4(TypedValue.Kind.DECIMAL, "float4"),
    FLOAT8(TypedValue.Kind.DECIMAL, "float8"),

    TEXT(TypedValue.Kind.TEXT, "text"),
    VARCHAR(TypedValue.Kind.TEXT, "varchar"),
    BPCHAR(TypedValue.Kind.TEXT, "bpchar"),
    CHAR(TypedValue.Kind.TEXT, "char"),
    NAME(TypedValue.Kind.TEXT, "name"),
    CITEXT(TypedValue.Kind.TEXT, "citext"),
    XML(TypedValue.Kind.TEXT, "xml"),
    INET(TypedValue.Kind.TEXT, "inet"),
    CIDR(TypedValue.Kind.TEXT, "cidr"),
    MACADDR(TypedValue.Kind.TEXT, "macaddr"),
    MACADDR8(TypedValue.Kind.TEXT, "macaddr8"),
    INTERVAL(TypedValue.Kind.TEXT, "interval"),
    MONEY(TypedValue.Kind.TEXT, "money"),
    BIT(TypedValue.Kind.TEXT, "bit"),
    VARBIT(TypedValue.Kind.TEXT, "varbit"),
    TIMETZ(TypedValue.Kind.TEXT, "timetz"),
    TSVECTOR(TypedValue.Kind.TEXT, "tsvector"),
    TSQUERY(TypedValue.Kind.TEXT, "tsquery"),
    ENUM(TypedValue.Kind.TEXT, "enum"),

    BYTEA(TypedValue.Kind.BINARY, "bytea"),

    DATE(TypedValue.Kind.TIMESTAMP, "date"),
    TIME(TypedValue.Kind.TIMESTAMP, "time"),
    TIMESTAMP(TypedValue.Kind.TIMESTAMP, "timestamp"),
    TIMESTAMPTZ(TypedValue.Kind.TIMESTAMP, "timestamptz"),

    UUID(TypedValue.Kind.UUID, "uuid"),

    JSON(TypedValue.Kind.JSON, "json"),
    JSONB(TypedValue.Kind.JSON, "jsonb");

    private static final Map<String, ElementType> INDEX_BY_CODE;

    static {
        INDEX_BY_CODE = new HashMap<>();
        for (ElementType elementType : values()) {
            INDEX_BY_CODE.put(elementType.code, elementType);
        }
    }

    private final TypedValue.Kind kind;
    private final String code;

    ElementType(TypedValue.Kind kind, String code) {
        this.kind = kind;
        this.code = code;
    }

    public TypedValue.Kind getKind() {
        return this.kind;
    }

    public String getCode() {
        return this.code;
    }

    public static boolean isKnown(String code) {
        return code != null && INDEX_BY_CODE.containsKey(code.toLowerCase());
    }

    public static ElementType byCode(String code) {
        ElementType elementType = (code != null) ? INDEX_BY_CODE.get(code.toLowerCase()) : null;

        if (elementType == null) {
            throw new TypeConversionException(String.format("unsupported element type: %s", code));
        }

        return elementType;
    }
}

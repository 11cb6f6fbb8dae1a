package io.xmin.replication.applier.reconcile;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.value.PrimaryKey;
import io.xmin.replication.model.value.TypedValue;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Orders primary keys the way PostgreSQL sorts them with {@code COLLATE "C"} on text columns.
 */
public class KeyOrder implements Comparator<PrimaryKey> {
    private static final Set<ElementType> ORDERED_TYPES = EnumSet.of(
            ElementType.BOOL,
            ElementType.INT2,
            ElementType.INT4,
            ElementType.INT8,
            ElementType.OID,
            ElementType.NUMERIC,
            ElementType.TEXT,
            ElementType.VARCHAR,
            ElementType.NAME,
            ElementType.BYTEA,
            ElementType.DATE,
            ElementType.TIME,
            ElementType.TIMESTAMP,
            ElementType.TIMESTAMPTZ,
            ElementType.UUID
    );

    private static final Set<ElementType> COLLATED_TYPES = EnumSet.of(
            ElementType.TEXT,
            ElementType.VARCHAR,
            ElementType.NAME
    );

    private final TableId tableId;

    public KeyOrder(TableId tableId) {
        this.tableId = tableId;
    }

    public static boolean supports(List<ColumnSchema> keyColumns) {
        return keyColumns.stream().allMatch(column -> !column.isArray() && KeyOrder.ORDERED_TYPES.contains(column.getElementType()));
    }

    public static boolean isCollated(ColumnSchema column) {
        return KeyOrder.COLLATED_TYPES.contains(column.getElementType());
    }

    @Override
    public int compare(PrimaryKey left, PrimaryKey right) {
        List<TypedValue> leftValues = left.getValues();
        List<TypedValue> rightValues = right.getValues();

        for (int index = 0; index < Math.min(leftValues.size(), rightValues.size()); index++) {
            int result = this.compare(leftValues.get(index), rightValues.get(index));

            if (result != 0) {
                return result;
            }
        }

        return Integer.compare(leftValues.size(), rightValues.size());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private int compare(TypedValue left, TypedValue right) {
        // nulls sort last
        if (left.isNull() || right.isNull()) {
            return Boolean.compare(left.isNull(), right.isNull());
        }

        if (left.getKind() != right.getKind()) {
            throw new ReconciliationException(this.tableId, String.format(
                    "cannot order %s key value against %s key value in %s", left.getKind(), right.getKind(), this.tableId
            ));
        }

        switch (left.getKind()) {
            case BOOLEAN:
                return Boolean.compare(left.asBoolean(), right.asBoolean());
            case INTEGER:
                return Long.compare(left.asLong(), right.asLong());
            case DECIMAL:
                return left.asDecimal().compareTo(right.asDecimal());
            case TEXT:
                return KeyOrder.compareUnsigned(left.asText().getBytes(StandardCharsets.UTF_8), right.asText().getBytes(StandardCharsets.UTF_8));
            case BINARY:
                return KeyOrder.compareUnsigned(left.asBytes(), right.asBytes());
            case UUID:
                return left.asUuid().toString().compareTo(right.asUuid().toString());
            case TIMESTAMP:
                return ((Comparable) left.asTemporal()).compareTo(right.asTemporal());
            default:
                throw new ReconciliationException(this.tableId, String.format("cannot order %s key values in %s", left.getKind(), this.tableId));
        }
    }

    private static int compareUnsigned(byte[] left, byte[] right) {
        for (int index = 0; index < Math.min(left.length, right.length); index++) {
            int result = Integer.compare(left[index] & 0xFF, right[index] & 0xFF);

            if (result != 0) {
                return result;
            }
        }

        return Integer.compare(left.length, right.length);
    }
}

package io.xmin.replication.model.row;

import io.xmin.replication.model.value.PrimaryKey;
import io.xmin.replication.model.value.TypedValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class RowChange implements Serializable {
    public static final long MAX_XMIN = 0xFFFFFFFFL;

    private final PrimaryKey primaryKey;
    private final Map<String, TypedValue> columns;
    private final long sourceXmin;

    public RowChange(PrimaryKey primaryKey, Map<String, TypedValue> columns, long sourceXmin) {
        if (sourceXmin < 0 || sourceXmin > RowChange.MAX_XMIN) {
            throw new IllegalArgumentException(String.format("xmin out of 32-bit range: %d", sourceXmin));
        }

        this.primaryKey = Objects.requireNonNull(primaryKey);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.sourceXmin = sourceXmin;
    }

    public PrimaryKey getPrimaryKey() {
        return this.primaryKey;
    }

    public Map<String, TypedValue> getColumns() {
        return this.columns;
    }

    public TypedValue getValue(String column) {
        TypedValue value = this.columns.get(column);
        return (value != null) ? value : TypedValue.nullValue();
    }

    public long getSourceXmin() {
        return this.sourceXmin;
    }

    public long estimatedSize() {
        long size = 0;

        for (Map.Entry<String, TypedValue> entry : this.columns.entrySet()) {
            size += entry.getKey().length() + entry.getValue().estimatedSize();
        }

        return size;
    }

    @Override
    public String toString() {
        return String.format("key: %s | xmin: %d", this.primaryKey, this.sourceXmin);
    }
}

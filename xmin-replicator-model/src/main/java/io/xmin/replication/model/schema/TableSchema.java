package io.xmin.replication.model.schema;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class TableSchema implements Serializable {

    private final TableId tableId;
    private final Map<String, ColumnSchema> columns;
    private final List<String> primaryKeyColumns;

    public TableSchema(TableId tableId, List<ColumnSchema> columns, List<String> primaryKeyColumns) {
        this.tableId = tableId;
        this.columns = new LinkedHashMap<>();

        for (ColumnSchema column : columns) {
            this.columns.put(column.getName(), column.withPrimary(primaryKeyColumns.contains(column.getName())));
        }

        for (String keyColumn : primaryKeyColumns) {
            if (!this.columns.containsKey(keyColumn)) {
                throw new IllegalArgumentException(String.format("primary key column %s not found in %s", keyColumn, tableId));
            }
        }

        this.primaryKeyColumns = Collections.unmodifiableList(new ArrayList<>(primaryKeyColumns));
    }

    public TableId getTableId() {
        return this.tableId;
    }

    public List<ColumnSchema> getColumns() {
        return new ArrayList<>(this.columns.values());
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(this.columns.keySet());
    }

    public ColumnSchema getColumn(String name) {
        return this.columns.get(name);
    }

    public List<String> getPrimaryKeyColumns() {
        return this.primaryKeyColumns;
    }

    public List<ColumnSchema> getPrimaryKeySchema() {
        return this.primaryKeyColumns.stream().map(this.columns::get).collect(Collectors.toList());
    }

    public boolean hasPrimaryKey() {
        return !this.primaryKeyColumns.isEmpty();
    }

    /**
     * Returns a copy that uses the given columns as key, for tables whose key is configured rather than declared.
     */
    public TableSchema withPrimaryKey(List<String> primaryKeyColumns) {
        return new TableSchema(this.tableId, this.getColumns(), primaryKeyColumns);
    }

    @Override
    public String toString() {
        return String.format("%s %s pk=%s", this.tableId, this.columns.values(), this.primaryKeyColumns);
    }
}

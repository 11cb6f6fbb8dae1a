package io.xmin.replication.model.schema;

import java.io.Serializable;
import java.util.Objects;

@SuppressWarnings("unused")
public class TableId implements Serializable, Comparable<TableId> {
    public static final String DEFAULT_SCHEMA = "public";

    private String schema;
    private String name;

    public TableId() { }

    public TableId(String schema, String name) {
        this.schema = Identifiers.validate(schema);
        this.name   = Identifiers.validate(name);
    }

    /**
     * Parses {@code schema.table} or a bare {@code table}, which falls back to the given schema.
     */
    public static TableId parse(String qualifiedName, String defaultSchema) {
        Objects.requireNonNull(qualifiedName, "table name required");

        String trimmed = qualifiedName.trim().replace("\"", "");
        int separator = trimmed.indexOf('.');

        if (separator > 0) {
            return new TableId(trimmed.substring(0, separator), trimmed.substring(separator + 1));
        } else {
            return new TableId(defaultSchema != null ? defaultSchema : TableId.DEFAULT_SCHEMA, trimmed);
        }
    }

    public String getSchema() {
        return this.schema;
    }

    public String getName() {
        return this.name;
    }

    public String getQualifiedName() {
        return String.format("%s.%s", this.schema, this.name);
    }

    public String toQuotedSql() {
        return String.format("%s.%s", Identifiers.quote(this.schema), Identifiers.quote(this.name));
    }

    @Override
    public int compareTo(TableId tableId) {
        if (tableId == null) {
            return 1;
        }

        return this.getQualifiedName().compareTo(tableId.getQualifiedName());
    }

    @Override
    public boolean equals(Object other) {
        if (other instanceof TableId) {
            TableId tableId = (TableId) other;
            return Objects.equals(this.schema, tableId.schema) && Objects.equals(this.name, tableId.name);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.schema, this.name);
    }

    @Override
    public String toString() {
        return this.getQualifiedName();
    }
}

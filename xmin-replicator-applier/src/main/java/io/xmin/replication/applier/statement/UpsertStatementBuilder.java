package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.Identifiers;
import io.xmin.replication.model.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class UpsertStatementBuilder {
    private final TableSchema table;
    private final String prefix;
    private final String rowPlaceholder;
    private final String conflictClause;

    public UpsertStatementBuilder(TableSchema table) {
        if (!table.hasPrimaryKey()) {
            throw new IllegalArgumentException(String.format("table %s has no primary key", table.getTableId()));
        }

        this.table = table;
        this.prefix = String.format(
                "INSERT INTO %s (%s) VALUES ",
                table.getTableId().toQuotedSql(),
                Identifiers.quoteAll(table.getColumnNames())
        );
        this.rowPlaceholder = table.getColumns().stream()
                .map(UpsertStatementBuilder::placeholder)
                .collect(Collectors.joining(", ", "(", ")"));
        this.conflictClause = this.conflictClause();
    }

    static String placeholder(ColumnSchema column) {
        return String.format("CAST(? AS %s)", column.getDeclaredType());
    }

    private String conflictClause() {
        List<String> updates = new ArrayList<>();

        for (String column : this.table.getColumnNames()) {
            if (!this.table.getPrimaryKeyColumns().contains(column)) {
                String quoted = Identifiers.quote(column);
                updates.add(String.format("%s = EXCLUDED.%s", quoted, quoted));
            }
        }

        String target = Identifiers.quoteAll(this.table.getPrimaryKeyColumns());

        // a table made only of key columns has nothing to update
        if (updates.isEmpty()) {
            return String.format(" ON CONFLICT (%s) DO NOTHING", target);
        }

        return String.format(" ON CONFLICT (%s) DO UPDATE SET %s", target, String.join(", ", updates));
    }

    public String build(int rowCount) {
        if (rowCount <= 0) {
            throw new IllegalArgumentException("at least one row is required");
        }

        StringBuilder sql = new StringBuilder(this.prefix.length() + rowCount * (this.rowPlaceholder.length() + 2) + this.conflictClause.length());

        sql.append(this.prefix);

        for (int row = 0; row < rowCount; row++) {
            if (row > 0) {
                sql.append(", ");
            }

            sql.append(this.rowPlaceholder);
        }

        return sql.append(this.conflictClause).toString();
    }

    public int getParametersPerRow() {
        return this.table.getColumns().size();
    }

    public TableSchema getTable() {
        return this.table;
    }
}

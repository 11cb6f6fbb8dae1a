package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.Identifiers;
import io.xmin.replication.model.schema.TableId;

import java.util.List;
import java.util.stream.Collectors;

public class DeleteStatementBuilder {
    private final String prefix;
    private final String keyPlaceholder;

    public DeleteStatementBuilder(TableId tableId, List<ColumnSchema> keyColumns) {
        if (keyColumns.isEmpty()) {
            throw new IllegalArgumentException(String.format("table %s has no primary key", tableId));
        }

        String placeholders = keyColumns.stream()
                .map(UpsertStatementBuilder::placeholder)
                .collect(Collectors.joining(", "));
        String columns = Identifiers.quoteAll(keyColumns.stream().map(ColumnSchema::getName).collect(Collectors.toList()));

        if (keyColumns.size() == 1) {
            this.prefix = String.format("DELETE FROM %s WHERE %s IN (", tableId.toQuotedSql(), columns);
            this.keyPlaceholder = placeholders;
        } else {
            this.prefix = String.format("DELETE FROM %s WHERE (%s) IN (", tableId.toQuotedSql(), columns);
            this.keyPlaceholder = "(" + placeholders + ")";
        }
    }

    public String build(int keyCount) {
        if (keyCount <= 0) {
            throw new IllegalArgumentException("at least one key is required");
        }

        StringBuilder sql = new StringBuilder(this.prefix);

        for (int key = 0; key < keyCount; key++) {
            if (key > 0) {
                sql.append(", ");
            }

            sql.append(this.keyPlaceholder);
        }

        return sql.append(")").toString();
    }
}

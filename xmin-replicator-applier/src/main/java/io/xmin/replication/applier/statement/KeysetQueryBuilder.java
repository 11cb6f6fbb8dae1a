package io.xmin.replication.applier.statement;

import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.Identifiers;
import io.xmin.replication.model.schema.TableId;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

public class KeysetQueryBuilder {
    private static final String COLLATE_C = " COLLATE \"C\"";

    private final String firstPage;
    private final String nextPage;

    public KeysetQueryBuilder(TableId tableId, List<ColumnSchema> keyColumns, Predicate<ColumnSchema> collated, int pageSize) {
        if (keyColumns.isEmpty()) {
            throw new IllegalArgumentException(String.format("table %s has no primary key", tableId));
        }

        String columns = Identifiers.quoteAll(keyColumns.stream().map(ColumnSchema::getName).collect(Collectors.toList()));
        String ordered = keyColumns.stream()
                .map(column -> Identifiers.quote(column.getName()) + (collated.test(column) ? KeysetQueryBuilder.COLLATE_C : ""))
                .collect(Collectors.joining(", "));
        String placeholders = keyColumns.stream()
                .map(UpsertStatementBuilder::placeholder)
                .collect(Collectors.joining(", "));

        this.firstPage = String.format("SELECT %s FROM %s ORDER BY %s LIMIT %d", columns, tableId.toQuotedSql(), ordered, pageSize);
        this.nextPage = String.format(
                "SELECT %s FROM %s WHERE (%s) > (%s) ORDER BY %s LIMIT %d",
                columns, tableId.toQuotedSql(), ordered, placeholders, ordered, pageSize
        );
    }

    public String firstPage() {
        return this.firstPage;
    }

    public String nextPage() {
        return this.nextPage;
    }
}

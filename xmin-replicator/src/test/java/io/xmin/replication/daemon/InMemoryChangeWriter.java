package io.xmin.replication.daemon;

import io.xmin.replication.applier.ApplyResult;
import io.xmin.replication.applier.ChangeWriter;
import io.xmin.replication.applier.RowApplyException;
import io.xmin.replication.model.row.ChangeBatch;
import io.xmin.replication.model.row.RowChange;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.model.value.PrimaryKey;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target tables kept in memory. Rows of the configured source xmins are rejected one by one.
 */
class InMemoryChangeWriter implements ChangeWriter {
    private final Map<TableId, Map<PrimaryKey, RowChange>> tables;
    private final Set<Long> rejectedXmins;

    InMemoryChangeWriter() {
        this.tables = new ConcurrentHashMap<>();
        this.rejectedXmins = ConcurrentHashMap.newKeySet();
    }

    void reject(long xmin) {
        this.rejectedXmins.add(xmin);
    }

    void accept(long xmin) {
        this.rejectedXmins.remove(xmin);
    }

    Map<PrimaryKey, RowChange> rows(TableId tableId) {
        return this.tables.computeIfAbsent(tableId, key -> new ConcurrentHashMap<>());
    }

    @Override
    public ApplyResult applyBatch(TableSchema table, ChangeBatch batch) throws SQLException {
        Map<PrimaryKey, RowChange> target = this.rows(table.getTableId());
        List<RowApplyException> failures = new ArrayList<>();
        int applied = 0;

        for (RowChange row : batch.getRows()) {
            if (this.rejectedXmins.contains(row.getSourceXmin())) {
                failures.add(new RowApplyException(row, new SQLException("value too long for type character varying(8)", "22001")));
            } else {
                target.put(row.getPrimaryKey(), row);
                applied++;
            }
        }

        return new ApplyResult(batch, applied, failures, null, -1L);
    }

    Set<PrimaryKey> keys(TableId tableId) {
        return new HashSet<>(this.rows(tableId).keySet());
    }
}

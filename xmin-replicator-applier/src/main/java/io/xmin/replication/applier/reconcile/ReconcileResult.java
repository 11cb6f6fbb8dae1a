package io.xmin.replication.applier.reconcile;

import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.value.PrimaryKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ReconcileResult {
    private final TableId tableId;
    private final List<PrimaryKey> deletedKeys;
    private final long deletedCount;
    private final RowCounts rowCounts;

    public ReconcileResult(TableId tableId, List<PrimaryKey> deletedKeys, RowCounts rowCounts) {
        this(tableId, deletedKeys, deletedKeys.size(), rowCounts);
    }

    public ReconcileResult(TableId tableId, List<PrimaryKey> deletedKeys, long deletedCount, RowCounts rowCounts) {
        this.tableId = tableId;
        this.deletedKeys = Collections.unmodifiableList(new ArrayList<>(deletedKeys));
        this.deletedCount = deletedCount;
        this.rowCounts = rowCounts;
    }

    public TableId getTableId() {
        return this.tableId;
    }

    /**
     * Empty when the keys were merged page by page, which does not keep them.
     */
    public List<PrimaryKey> getDeletedKeys() {
        return this.deletedKeys;
    }

    public long getDeletedCount() {
        return this.deletedCount;
    }

    public RowCounts getRowCounts() {
        return this.rowCounts;
    }

    @Override
    public String toString() {
        return String.format("table: %s | deleted: %d | %s", this.tableId, this.deletedCount, this.rowCounts);
    }
}

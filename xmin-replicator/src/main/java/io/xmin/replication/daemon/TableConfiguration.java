package io.xmin.replication.daemon;

import io.xmin.replication.model.schema.TableId;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

public class TableConfiguration {
    private final TableId tableId;
    private final int batchRows;
    private final Duration syncInterval;
    private final Duration reconcileInterval;
    private final int reconcileEveryCycles;
    private final List<String> primaryKeyOverride;

    public TableConfiguration(
            TableId tableId,
            int batchRows,
            Duration syncInterval,
            Duration reconcileInterval,
            int reconcileEveryCycles,
            List<String> primaryKeyOverride) {
        if (batchRows <= 0) {
            throw new IllegalArgumentException(String.format("%s: batch rows must be positive, got %d", tableId, batchRows));
        }

        this.tableId = tableId;
        this.batchRows = batchRows;
        this.syncInterval = syncInterval;
        this.reconcileInterval = reconcileInterval;
        this.reconcileEveryCycles = reconcileEveryCycles;
        this.primaryKeyOverride = (primaryKeyOverride != null) ? primaryKeyOverride : Collections.emptyList();
    }

    public TableId getTableId() {
        return this.tableId;
    }

    public int getBatchRows() {
        return this.batchRows;
    }

    public Duration getSyncInterval() {
        return this.syncInterval;
    }

    /**
     * Zero disables the timer.
     */
    public Duration getReconcileInterval() {
        return this.reconcileInterval;
    }

    /**
     * Zero disables cycle based reconciliation.
     */
    public int getReconcileEveryCycles() {
        return this.reconcileEveryCycles;
    }

    public List<String> getPrimaryKeyOverride() {
        return this.primaryKeyOverride;
    }

    @Override
    public String toString() {
        return String.format(
                "%s | batch: %d rows | sync every %d ms | reconcile every %d ms or %d cycles",
                this.tableId, this.batchRows, this.syncInterval.toMillis(), this.reconcileInterval.toMillis(), this.reconcileEveryCycles
        );
    }
}

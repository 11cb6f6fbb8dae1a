package io.xmin.replication.status;

import io.xmin.replication.model.schema.TableId;

public class TableStatus {
    private final TableId tableId;
    private final TableState state;
    private final int consecutiveFailures;
    private final String lastError;
    private final long highWaterMark;
    private final long updatedAt;

    public TableStatus(TableId tableId, TableState state, int consecutiveFailures, String lastError, long highWaterMark, long updatedAt) {
        this.tableId = tableId;
        this.state = state;
        this.consecutiveFailures = consecutiveFailures;
        this.lastError = lastError;
        this.highWaterMark = highWaterMark;
        this.updatedAt = updatedAt;
    }

    public TableId getTableId() {
        return this.tableId;
    }

    public TableState getState() {
        return this.state;
    }

    public int getConsecutiveFailures() {
        return this.consecutiveFailures;
    }

    public String getLastError() {
        return this.lastError;
    }

    public long getHighWaterMark() {
        return this.highWaterMark;
    }

    public long getUpdatedAt() {
        return this.updatedAt;
    }

    @Override
    public String toString() {
        return String.format(
                "%s %s | failures: %d | mark: %d%s",
                this.tableId, this.state, this.consecutiveFailures, this.highWaterMark,
                (this.lastError != null) ? " | last error: " + this.lastError : ""
        );
    }
}

package io.xmin.replication.status;

import io.xmin.replication.model.schema.TableId;

public class CycleEvent {

    public enum Type {
        SYNCED,
        EMPTY,
        CATCH_UP,
        WRAPAROUND,
        ROW_FAILED,
        ERROR,
        RECONCILED,
        RECONCILE_SKIPPED,
        EXCLUDED
    }

    private final TableId tableId;
    private final Type type;
    private final long rowsFetched;
    private final long rowsApplied;
    private final long rowsFailed;
    private final long rowsDeleted;
    private final long oldMark;
    private final long newMark;
    private final Throwable error;
    private final long timestamp;

    private CycleEvent(Builder builder) {
        this.tableId = builder.tableId;
        this.type = builder.type;
        this.rowsFetched = builder.rowsFetched;
        this.rowsApplied = builder.rowsApplied;
        this.rowsFailed = builder.rowsFailed;
        this.rowsDeleted = builder.rowsDeleted;
        this.oldMark = builder.oldMark;
        this.newMark = builder.newMark;
        this.error = builder.error;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder(TableId tableId, Type type, long timestamp) {
        return new Builder(tableId, type, timestamp);
    }

    public TableId getTableId() {
        return this.tableId;
    }

    public Type getType() {
        return this.type;
    }

    public long getRowsFetched() {
        return this.rowsFetched;
    }

    public long getRowsApplied() {
        return this.rowsApplied;
    }

    public long getRowsFailed() {
        return this.rowsFailed;
    }

    public long getRowsDeleted() {
        return this.rowsDeleted;
    }

    public long getOldMark() {
        return this.oldMark;
    }

    public long getNewMark() {
        return this.newMark;
    }

    public Throwable getError() {
        return this.error;
    }

    public long getTimestamp() {
        return this.timestamp;
    }

    @Override
    public String toString() {
        return String.format(
                "%s %s | fetched: %d | applied: %d | failed: %d | deleted: %d | mark: %d -> %d%s",
                this.tableId, this.type, this.rowsFetched, this.rowsApplied, this.rowsFailed, this.rowsDeleted,
                this.oldMark, this.newMark, (this.error != null) ? " | error: " + this.error.getMessage() : ""
        );
    }

    public static final class Builder {
        private final TableId tableId;
        private final Type type;
        private final long timestamp;

        private long rowsFetched;
        private long rowsApplied;
        private long rowsFailed;
        private long rowsDeleted;
        private long oldMark;
        private long newMark;
        private Throwable error;

        private Builder(TableId tableId, Type type, long timestamp) {
            this.tableId = tableId;
            this.type = type;
            this.timestamp = timestamp;
        }

        public Builder rows(long fetched, long applied, long failed) {
            this.rowsFetched = fetched;
            this.rowsApplied = applied;
            this.rowsFailed = failed;
            return this;
        }

        public Builder deleted(long deleted) {
            this.rowsDeleted = deleted;
            return this;
        }

        public Builder marks(long oldMark, long newMark) {
            this.oldMark = oldMark;
            this.newMark = newMark;
            return this;
        }

        public Builder error(Throwable error) {
            this.error = error;
            return this;
        }

        public CycleEvent build() {
            return new CycleEvent(this);
        }
    }
}

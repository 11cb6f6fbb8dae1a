package io.xmin.replication.commons.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.xmin.replication.model.schema.TableId;

import java.io.Serializable;
import java.util.Objects;

/**
 * Per-table cycle state. Every transition returns a new instance; the daemon passes it from
 * one step to the next and hands it to the store once the batch it describes has committed.
 */
@SuppressWarnings("unused")
public final class SyncState implements Serializable {
    private final String schema;
    private final String table;
    private final long highWaterMark;
    private final long lastReconcileAt;
    private final long lastSyncAt;
    private final long lastRowCount;
    private final String sourceFingerprint;
    private final String targetFingerprint;

    @JsonCreator
    public SyncState(
            @JsonProperty("schema") String schema,
            @JsonProperty("table") String table,
            @JsonProperty("highWaterMark") long highWaterMark,
            @JsonProperty("lastReconcileAt") long lastReconcileAt,
            @JsonProperty("lastSyncAt") long lastSyncAt,
            @JsonProperty("lastRowCount") long lastRowCount,
            @JsonProperty("sourceFingerprint") String sourceFingerprint,
            @JsonProperty("targetFingerprint") String targetFingerprint
    ) {
        this.schema = schema;
        this.table = table;
        this.highWaterMark = highWaterMark;
        this.lastReconcileAt = lastReconcileAt;
        this.lastSyncAt = lastSyncAt;
        this.lastRowCount = lastRowCount;
        this.sourceFingerprint = sourceFingerprint;
        this.targetFingerprint = targetFingerprint;
    }

    public static SyncState seed(TableId tableId, long highWaterMark, Fingerprint fingerprint) {
        return new SyncState(
                tableId.getSchema(),
                tableId.getName(),
                highWaterMark,
                0L,
                0L,
                0L,
                fingerprint.getSource(),
                fingerprint.getTarget()
        );
    }

    public String getSchema() {
        return this.schema;
    }

    public String getTable() {
        return this.table;
    }

    @JsonIgnore
    public TableId getTableId() {
        return new TableId(this.schema, this.table);
    }

    public long getHighWaterMark() {
        return this.highWaterMark;
    }

    public long getLastReconcileAt() {
        return this.lastReconcileAt;
    }

    public long getLastSyncAt() {
        return this.lastSyncAt;
    }

    public long getLastRowCount() {
        return this.lastRowCount;
    }

    public String getSourceFingerprint() {
        return this.sourceFingerprint;
    }

    public String getTargetFingerprint() {
        return this.targetFingerprint;
    }

    /**
     * Moves the mark forward after a committed batch. A lower mark is ignored, the mark never goes back
     * outside of {@link #resetForWraparound(long)}.
     */
    public SyncState advance(long newHighWaterMark, long rowCount, long timestamp) {
        return new SyncState(
                this.schema,
                this.table,
                Math.max(this.highWaterMark, newHighWaterMark),
                this.lastReconcileAt,
                timestamp,
                rowCount,
                this.sourceFingerprint,
                this.targetFingerprint
        );
    }

    public SyncState resetForWraparound(long timestamp) {
        return new SyncState(
                this.schema,
                this.table,
                0L,
                this.lastReconcileAt,
                timestamp,
                0L,
                this.sourceFingerprint,
                this.targetFingerprint
        );
    }

    public SyncState reconciled(long timestamp) {
        return new SyncState(
                this.schema,
                this.table,
                this.highWaterMark,
                timestamp,
                this.lastSyncAt,
                this.lastRowCount,
                this.sourceFingerprint,
                this.targetFingerprint
        );
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SyncState)) {
            return false;
        }

        SyncState state = (SyncState) other;

        return this.highWaterMark == state.highWaterMark
                && this.lastReconcileAt == state.lastReconcileAt
                && this.lastSyncAt == state.lastSyncAt
                && this.lastRowCount == state.lastRowCount
                && Objects.equals(this.schema, state.schema)
                && Objects.equals(this.table, state.table)
                && Objects.equals(this.sourceFingerprint, state.sourceFingerprint)
                && Objects.equals(this.targetFingerprint, state.targetFingerprint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.schema, this.table, this.highWaterMark, this.lastReconcileAt, this.sourceFingerprint, this.targetFingerprint);
    }

    @Override
    public String toString() {
        return String.format("table: %s.%s | mark: %d | reconciled: %d | rows: %d", this.schema, this.table, this.highWaterMark, this.lastReconcileAt, this.lastRowCount);
    }
}

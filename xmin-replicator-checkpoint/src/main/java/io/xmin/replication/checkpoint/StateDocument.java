package io.xmin.replication.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.xmin.replication.commons.checkpoint.SyncState;

import java.util.Map;
import java.util.TreeMap;

@SuppressWarnings("unused")
public class StateDocument {
    public static final int CURRENT_VERSION = 1;

    private final int version;
    private final long createdAt;
    private long updatedAt;
    private final Map<String, SyncState> tables;

    @JsonCreator
    public StateDocument(
            @JsonProperty("version") int version,
            @JsonProperty("createdAt") long createdAt,
            @JsonProperty("updatedAt") long updatedAt,
            @JsonProperty("tables") Map<String, SyncState> tables
    ) {
        this.version = version;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.tables = (tables != null) ? new TreeMap<>(tables) : new TreeMap<>();
    }

    public static StateDocument create(long timestamp) {
        return new StateDocument(StateDocument.CURRENT_VERSION, timestamp, timestamp, null);
    }

    public int getVersion() {
        return this.version;
    }

    public long getCreatedAt() {
        return this.createdAt;
    }

    public long getUpdatedAt() {
        return this.updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Map<String, SyncState> getTables() {
        return this.tables;
    }
}

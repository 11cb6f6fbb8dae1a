package io.xmin.replication.status;

import io.xmin.replication.model.schema.TableId;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class TableStatusRegistry {
    private final ConcurrentMap<TableId, TableStatus> statuses;

    public TableStatusRegistry() {
        this.statuses = new ConcurrentHashMap<>();
    }

    public void update(TableStatus status) {
        this.statuses.put(status.getTableId(), status);
    }

    public TableStatus get(TableId tableId) {
        return this.statuses.get(tableId);
    }

    public TableState getState(TableId tableId) {
        TableStatus status = this.statuses.get(tableId);
        return (status != null) ? status.getState() : null;
    }

    public Map<TableId, TableStatus> snapshot() {
        return new TreeMap<>(this.statuses);
    }
}

package io.xmin.replication.applier.reconcile;

import io.xmin.replication.model.schema.TableId;

public class ReconciliationException extends RuntimeException {
    private final TableId tableId;

    public ReconciliationException(TableId tableId, String message) {
        super(message);

        this.tableId = tableId;
    }

    public ReconciliationException(TableId tableId, String message, Throwable cause) {
        super(message, cause);

        this.tableId = tableId;
    }

    public TableId getTableId() {
        return this.tableId;
    }
}

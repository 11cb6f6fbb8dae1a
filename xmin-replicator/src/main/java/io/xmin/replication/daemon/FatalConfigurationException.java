package io.xmin.replication.daemon;

import io.xmin.replication.model.schema.TableId;

public class FatalConfigurationException extends RuntimeException {
    private final TableId tableId;

    public FatalConfigurationException(TableId tableId, String message) {
        super(String.format("%s: %s", tableId, message));
        this.tableId = tableId;
    }

    public TableId getTableId() {
        return this.tableId;
    }
}

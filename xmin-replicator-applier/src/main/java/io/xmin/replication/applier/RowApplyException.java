package io.xmin.replication.applier;

import io.xmin.replication.model.row.RowChange;

import java.sql.SQLException;

public class RowApplyException extends RuntimeException {
    private final transient RowChange row;

    public RowApplyException(RowChange row, SQLException cause) {
        super(String.format("cannot apply row %s: %s", row, cause.getMessage()), cause);

        this.row = row;
    }

    public RowChange getRow() {
        return this.row;
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}

package io.xmin.replication.model.row;

import io.xmin.replication.model.schema.TableId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ChangeBatch {
    private final TableId tableId;
    private final long sinceXmin;
    private final List<RowChange> rows;
    private final int limit;
    private final boolean full;

    public ChangeBatch(TableId tableId, long sinceXmin, List<RowChange> rows, int limit, boolean full) {
        long previous = -1;

        for (RowChange row : rows) {
            if (row.getSourceXmin() < previous) {
                throw new IllegalArgumentException(String.format("rows of %s are not ordered by xmin", tableId));
            }

            previous = row.getSourceXmin();
        }

        this.tableId = tableId;
        this.sinceXmin = sinceXmin;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.limit = limit;
        this.full = full;
    }

    public static ChangeBatch empty(TableId tableId, long sinceXmin, int limit) {
        return new ChangeBatch(tableId, sinceXmin, Collections.emptyList(), limit, false);
    }

    public TableId getTableId() {
        return this.tableId;
    }

    public long getSinceXmin() {
        return this.sinceXmin;
    }

    public List<RowChange> getRows() {
        return this.rows;
    }

    public int getLimit() {
        return this.limit;
    }

    public boolean isFull() {
        return this.full;
    }

    public boolean isEmpty() {
        return this.rows.isEmpty();
    }

    public int size() {
        return this.rows.size();
    }

    /**
     * Highest xmin in the batch, or the mark it was read from when empty.
     */
    public long getMaxXmin() {
        return this.rows.isEmpty() ? this.sinceXmin : this.rows.get(this.rows.size() - 1).getSourceXmin();
    }

    public long estimatedSize() {
        long size = 0;

        for (RowChange row : this.rows) {
            size += row.estimatedSize();
        }

        return size;
    }

    @Override
    public String toString() {
        return String.format("table: %s | since: %d | rows: %d | full: %s", this.tableId, this.sinceXmin, this.rows.size(), this.full);
    }
}

package io.xmin.replication.applier;

import io.xmin.replication.model.row.ChangeBatch;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ApplyResult {
    private final ChangeBatch batch;
    private final int rowsApplied;
    private final List<RowApplyException> rowFailures;
    private final SQLException batchFailure;
    private final long firstUnappliedXmin;

    public ApplyResult(ChangeBatch batch, int rowsApplied, List<RowApplyException> rowFailures, SQLException batchFailure, long firstUnappliedXmin) {
        this.batch = batch;
        this.rowsApplied = rowsApplied;
        this.rowFailures = Collections.unmodifiableList(new ArrayList<>(rowFailures));
        this.batchFailure = batchFailure;
        this.firstUnappliedXmin = firstUnappliedXmin;
    }

    public static ApplyResult applied(ChangeBatch batch) {
        return new ApplyResult(batch, batch.size(), Collections.emptyList(), null, -1L);
    }

    public ChangeBatch getBatch() {
        return this.batch;
    }

    public int getRowsApplied() {
        return this.rowsApplied;
    }

    public List<RowApplyException> getRowFailures() {
        return this.rowFailures;
    }

    public SQLException getBatchFailure() {
        return this.batchFailure;
    }

    public int getRowsFailed() {
        return this.batch.size() - this.rowsApplied;
    }

    public boolean isComplete() {
        return this.rowFailures.isEmpty() && this.batchFailure == null;
    }

    /**
     * Highest mark below every row that did not commit. Rows past a failure are re-read on the next fetch.
     */
    public long getSafeMark() {
        long minimumFailedXmin = Long.MAX_VALUE;

        for (RowApplyException failure : this.rowFailures) {
            minimumFailedXmin = Math.min(minimumFailedXmin, failure.getRow().getSourceXmin());
        }

        if (this.firstUnappliedXmin >= 0) {
            minimumFailedXmin = Math.min(minimumFailedXmin, this.firstUnappliedXmin);
        }

        if (minimumFailedXmin == Long.MAX_VALUE) {
            return this.batch.getMaxXmin();
        }

        return Math.min(this.batch.getMaxXmin(), Math.max(this.batch.getSinceXmin(), minimumFailedXmin - 1));
    }

    @Override
    public String toString() {
        return String.format(
                "table: %s | applied: %d | failed: %d | mark: %d",
                this.batch.getTableId(), this.rowsApplied, this.getRowsFailed(), this.getSafeMark()
        );
    }
}

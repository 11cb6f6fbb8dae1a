package io.xmin.replication.applier;

import io.xmin.replication.model.row.RowChange;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts rows into sub-batches by estimated payload size, keeping their order. A sub-batch never binds
 * more than {@link #MAXIMUM_PARAMETERS} parameters and always holds at least one row.
 */
public class BatchSplitter {
    public static final long DEFAULT_BUDGET_BYTES = 10L * 1024L * 1024L;
    public static final int MAXIMUM_PARAMETERS = 65000;

    private final long budgetBytes;

    public BatchSplitter(long budgetBytes) {
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException(String.format("payload budget must be positive: %d", budgetBytes));
        }

        this.budgetBytes = budgetBytes;
    }

    public long getBudgetBytes() {
        return this.budgetBytes;
    }

    public List<List<RowChange>> split(List<RowChange> rows, int parametersPerRow) {
        int maximumRows = Math.max(1, BatchSplitter.MAXIMUM_PARAMETERS / Math.max(1, parametersPerRow));

        List<List<RowChange>> subBatches = new ArrayList<>();
        List<RowChange> current = new ArrayList<>();
        long currentBytes = 0;

        for (RowChange row : rows) {
            long rowBytes = row.estimatedSize();

            if (!current.isEmpty() && (currentBytes + rowBytes > this.budgetBytes || current.size() >= maximumRows)) {
                subBatches.add(current);
                current = new ArrayList<>();
                currentBytes = 0;
            }

            current.add(row);
            currentBytes += rowBytes;
        }

        if (!current.isEmpty()) {
            subBatches.add(current);
        }

        return subBatches;
    }
}
